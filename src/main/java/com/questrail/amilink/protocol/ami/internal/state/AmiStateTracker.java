package com.questrail.amilink.protocol.ami.internal.state;

import com.questrail.amilink.api.CallRecord;
import com.questrail.amilink.api.DeviceState;
import com.questrail.amilink.protocol.ami.model.AmiMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * AmiStateTracker
 * -----------------------------------------------------------------------------
 * Derived live state of the switch: calls in progress keyed by
 * {@code Uniqueid}, and last known device states keyed by device identifier.
 *
 * <h2>Role in the architecture</h2>
 * The tracker is the built-in first consumer of every dispatched event. It is:
 * <ul>
 *   <li>Synchronous: it applies one event completely before returning</li>
 *   <li>I/O-free: it never touches the network or disk, so it can never stall
 *       the inbound stream</li>
 *   <li>Tolerant: events for unknown calls, missing headers and unrecognized
 *       event names are no-ops, never errors</li>
 * </ul>
 *
 * <h2>Event table</h2>
 * <pre>
 *   Newchannel          → insert call, state "ringing"
 *   Newstate            → replace state with ChannelState, verbatim
 *   BridgeEnter, Bridge → state "bridged"
 *   Hangup              → remove call
 *   CoreShowChannel     → insert call if absent (bulk status after login)
 *   DeviceStateChange   → upsert device
 *   ExtensionStatus     → upsert device
 *   Queue*              → recognized, no derived state
 * </pre>
 * Supporting another event is one more entry in the table.
 *
 * <h2>Generations</h2>
 * State is only valid for the connection that produced it. Each connection
 * gets a generation number; {@link #reset(long)} clears everything and
 * switches generation, and {@link #apply(long, AmiMessage)} ignores events
 * from any other generation. Events of a dead connection still queued behind
 * a reset can therefore never repopulate the maps.
 *
 * <h2>Thread Safety</h2>
 * One event thread mutates; any thread reads. All access goes through a single
 * lock and readers get copies.
 */
public final class AmiStateTracker
{
    private static final Logger log = LoggerFactory.getLogger(AmiStateTracker.class);

    static final String RINGING = "ringing";
    static final String BRIDGED = "bridged";
    static final String UNKNOWN_STATE = "unknown";

    private static final Set<String> QUEUE_EVENTS = Set.of(
            "queuememberstatus", "queueparams", "queueentry", "queuemember",
            "queuecallerjoin", "queuecallerleave", "queuecallerabandon",
            "queuememberadded", "queuememberremoved", "queuememberpause",
            "queuestatuscomplete");

    private final Clock clock;
    private final Object lock = new Object();
    private final Map<String, Consumer<AmiMessage>> handlers = new HashMap<>();

    private final Map<String, CallRecord> calls = new LinkedHashMap<>();
    private final Map<String, DeviceState> devices = new LinkedHashMap<>();
    private long generation;

    public AmiStateTracker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");

        handlers.put("newchannel", this::onNewChannel);
        handlers.put("newstate", this::onNewState);
        handlers.put("bridgeenter", this::onBridgeEnter);
        handlers.put("bridge", this::onLegacyBridge);
        handlers.put("hangup", this::onHangup);
        handlers.put("coreshowchannel", this::onCoreShowChannel);
        handlers.put("devicestatechange", this::onDeviceStateChange);
        handlers.put("extensionstatus", this::onExtensionStatus);
        for (String queueEvent : QUEUE_EVENTS) {
            handlers.put(queueEvent, e -> {});
        }
    }

    /**
     * Apply one event if it belongs to the current generation.
     *
     * @return {@code true} if the event name is one the tracker recognizes and
     *         the event was applied
     */
    public boolean apply(long eventGeneration, AmiMessage event) {
        Objects.requireNonNull(event, "event");
        if (!event.isEvent()) {
            return false;
        }
        Consumer<AmiMessage> handler = handlers.get(event.name().toLowerCase(Locale.ROOT));
        if (handler == null) {
            return false;
        }
        synchronized (lock) {
            if (eventGeneration != generation) {
                return false;
            }
            handler.accept(event);
        }
        return true;
    }

    /**
     * Clear all calls and devices and start accepting events of {@code newGeneration}.
     */
    public void reset(long newGeneration) {
        synchronized (lock) {
            int dropped = calls.size();
            calls.clear();
            devices.clear();
            generation = newGeneration;
            if (dropped > 0) {
                log.debug("Cleared {} calls for connection #{}", dropped, newGeneration);
            }
        }
    }

    public boolean isCurrent(long eventGeneration) {
        synchronized (lock) {
            return eventGeneration == generation;
        }
    }

    public List<CallRecord> activeCalls() {
        synchronized (lock) {
            return List.copyOf(new ArrayList<>(calls.values()));
        }
    }

    public Optional<CallRecord> call(String uniqueid) {
        synchronized (lock) {
            return Optional.ofNullable(calls.get(uniqueid));
        }
    }

    public Map<String, DeviceState> deviceStates() {
        synchronized (lock) {
            return Map.copyOf(devices);
        }
    }

    // ---------------------------------------------------------------------
    // Event handlers (called with the lock held)
    // ---------------------------------------------------------------------

    private void onNewChannel(AmiMessage e) {
        Optional<String> uniqueid = e.get("Uniqueid");
        if (uniqueid.isEmpty()) {
            return;
        }
        CallRecord call = newCall(e, uniqueid.get(), RINGING);
        calls.put(call.uniqueid(), call);
        log.debug("New call {}: {} -> {}", call.uniqueid(), call.callerId(), call.destination());
    }

    private void onCoreShowChannel(AmiMessage e) {
        Optional<String> uniqueid = e.get("Uniqueid");
        if (uniqueid.isEmpty() || calls.containsKey(uniqueid.get())) {
            return;
        }
        String state = e.get("ChannelStateDesc").orElse(e.getOrDefault("ChannelState", UNKNOWN_STATE));
        calls.put(uniqueid.get(), newCall(e, uniqueid.get(), state));
    }

    private void onNewState(AmiMessage e) {
        e.get("Uniqueid").ifPresent(id ->
                calls.computeIfPresent(id, (k, call) -> call.withState(e.getOrDefault("ChannelState", UNKNOWN_STATE))));
    }

    private void onBridgeEnter(AmiMessage e) {
        e.get("Uniqueid").ifPresent(this::markBridged);
    }

    private void onLegacyBridge(AmiMessage e) {
        if (!e.getOrDefault("Bridgestate", "").equalsIgnoreCase("Link")) {
            return;
        }
        e.get("Uniqueid1").ifPresent(this::markBridged);
        e.get("Uniqueid2").ifPresent(this::markBridged);
    }

    private void markBridged(String uniqueid) {
        calls.computeIfPresent(uniqueid, (k, call) -> call.withState(BRIDGED));
    }

    private void onHangup(AmiMessage e) {
        e.get("Uniqueid").ifPresent(id -> {
            CallRecord ended = calls.remove(id);
            if (ended != null) {
                log.debug("Call ended {}: {} -> {}", id, ended.callerId(), ended.destination());
            }
        });
    }

    private void onDeviceStateChange(AmiMessage e) {
        upsertDevice(e.getOrDefault("Device", ""), e.getOrDefault("State", ""));
    }

    private void onExtensionStatus(AmiMessage e) {
        String device = e.get("Device").orElse(e.getOrDefault("Exten", ""));
        String state = e.get("State")
                .or(() -> e.get("StatusText"))
                .orElse(e.getOrDefault("Status", ""));
        upsertDevice(device, state);
    }

    private void upsertDevice(String device, String state) {
        if (device.isEmpty()) {
            return;
        }
        devices.put(device, new DeviceState(device, state, clock.instant()));
    }

    private CallRecord newCall(AmiMessage e, String uniqueid, String state) {
        String channel = e.getOrDefault("Channel", "");
        String context = e.getOrDefault("Context", "");
        return new CallRecord(
                uniqueid,
                channel,
                e.getOrDefault("CallerIDNum", ""),
                e.getOrDefault("Exten", ""),
                context,
                AmiChannels.extensionOf(channel),
                state,
                AmiChannels.directionOf(context),
                clock.instant());
    }
}
