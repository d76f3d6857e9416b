package com.questrail.amilink.api;

import com.questrail.amilink.protocol.ami.model.AmiAction;
import com.questrail.amilink.protocol.ami.model.AmiResponse;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * AmiClient
 * -----------------------------------------------------------------------------
 * {@code AmiClient} is the complete surface that collaborators (REST façades,
 * periodic sync tasks, dashboards) use to talk to a telephony switch over the
 * Asterisk Manager Interface.
 *
 * <h2>Core Responsibilities</h2>
 * <ul>
 *   <li>Owning exactly one manager connection and its login session</li>
 *   <li>Sending actions and returning the response correlated to each one</li>
 *   <li>Delivering unsolicited events to registered handlers, in wire order</li>
 *   <li>Exposing point-in-time copies of live call and device state</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Queue strategy or call-routing semantics</li>
 *   <li>Loading its own configuration</li>
 *   <li>Persisting or forwarding snapshots</li>
 * </ul>
 *
 * <h2>Availability</h2>
 * Connection loss is transient. It is reflected by {@link #isConnected()} and
 * {@link #connectionState()}, never surfaced as a fatal error. While the client
 * is not {@link ConnectionState#READY}, {@link #sendAction(AmiAction)} fails
 * fast with {@link AmiTransportException}.
 *
 * <h2>State views</h2>
 * {@link #activeCalls()} and {@link #deviceStates()} return copies. They are
 * valid only for the connection that produced them and are cleared on
 * disconnect.
 */
public interface AmiClient
{
    /**
     * Open the transport, read the greeting and log in.
     *
     * @throws AmiTransportException if the transport cannot be opened or is lost
     *                               before the session is ready
     * @throws AmiAuthenticationException if the switch rejects the credentials
     */
    void connect();

    /**
     * Best-effort logoff, then close the transport and clear all derived state.
     * Outstanding actions fail with {@link ConnectionClosedException}.
     */
    void disconnect();

    /**
     * Disconnect, wait the configured reconnect backoff, then connect.
     */
    void reconnect();

    /**
     * @return {@code true} only when connected, authenticated and listening
     */
    boolean isConnected();

    ConnectionState connectionState();

    /**
     * Send an action and block until its correlated response arrives.
     *
     * @throws ActionTimeoutException if no matching response arrives in time
     * @throws AmiTransportException if the client is not ready or the write fails
     * @throws ConnectionClosedException if the connection goes away first
     */
    AmiResponse sendAction(AmiAction action);

    /**
     * Send an action without blocking. The returned future completes
     * exceptionally with the same exceptions {@link #sendAction(AmiAction)} throws.
     *
     * <p>The future is never completed on the thread that reads from the switch;
     * responses are handed over on a callback thread. Dependent stages may
     * therefore block, including on {@link #sendAction(AmiAction)}.</p>
     */
    CompletableFuture<AmiResponse> sendActionAsync(AmiAction action);

    default AmiResponse sendAction(String actionName, Map<String, String> parameters) {
        return sendAction(AmiAction.of(actionName, parameters));
    }

    /**
     * Register a handler for an event name (case-insensitive). The name {@code "*"}
     * receives every event plus every response that matched no pending action.
     * Handlers registered while events are flowing apply to subsequent events only.
     */
    void registerEventHandler(String eventName, AmiEventHandler handler);

    boolean unregisterEventHandler(String eventName, AmiEventHandler handler);

    /**
     * @return a copy of the calls currently in progress
     */
    List<CallRecord> activeCalls();

    /**
     * @return a copy of the last known device states keyed by device identifier
     */
    Map<String, DeviceState> deviceStates();

    // -------------------------------------------------------------------------
    // Convenience actions
    // -------------------------------------------------------------------------

    /**
     * Request the status of one queue. Queue members and callers arrive as the
     * response's collected events.
     */
    default AmiResponse queueStatus(String queue) {
        return sendAction(AmiAction.builder("QueueStatus").header("Queue", queue).build());
    }

    /**
     * Look up the hint state of an extension.
     *
     * @return the state text reported by the switch, if the lookup succeeded
     */
    default Optional<String> extensionState(String exten, String context) {
        AmiResponse response = sendAction(AmiAction.builder("ExtensionState")
                .header("Exten", exten)
                .header("Context", context)
                .build());
        if (!response.isSuccess()) {
            return Optional.empty();
        }
        Optional<String> text = response.message().get("StatusText");
        return text.isPresent() ? text : response.message().get("Status");
    }
}
