package com.questrail.amilink.protocol.ami.observability;

/**
 * Receives lifecycle and anomaly notifications from the client.
 * Implementations can provide logging, metrics, or alerting.
 *
 * <p>Callbacks arrive from several threads (caller, inbound I/O, event loop)
 * and must not block.</p>
 */
public interface AmiObservabilitySink {
    /**
     * Called on every connection state change.
     */
    void onStateTransition(AmiConnectionTransitionEvent event);

    /**
     * Called when an error is absorbed to keep the connection running.
     */
    void onError(AmiErrorEvent event);
}
