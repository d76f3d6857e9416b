package com.questrail.amilink.protocol.ami.internal.dispatch;

import com.questrail.amilink.api.AmiEventHandler;
import com.questrail.amilink.protocol.ami.internal.state.AmiStateTracker;
import com.questrail.amilink.protocol.ami.model.AmiMessage;
import com.questrail.amilink.protocol.ami.observability.AmiErrorEvent;
import com.questrail.amilink.protocol.ami.observability.AmiObservabilitySink;
import com.questrail.amilink.protocol.ami.observability.NullObservabilitySink;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * AmiEventDispatcher
 * =============================================================================
 * Fans one inbound message out to the state tracker and to registered handlers.
 *
 * <h2>Delivery order for one event</h2>
 * <ol>
 *   <li>{@link AmiStateTracker}, always first, so handlers observe state that
 *       already reflects the event</li>
 *   <li>handlers registered for the event name, in registration order</li>
 *   <li>handlers registered under {@link #WILDCARD}, in registration order</li>
 * </ol>
 * Responses that no pending action claimed skip the tracker and go to
 * wildcard handlers only.
 *
 * <h2>Failure isolation</h2>
 * A handler that throws is reported to the observability sink and skipped;
 * the remaining handlers still run and the inbound stream is unaffected.
 *
 * <h2>Thread Safety</h2>
 * {@link #dispatch(long, AmiMessage)} is called from one thread only. Handler
 * registration may happen from any thread at any time; registrations made
 * during a dispatch apply to the next message.
 */
public final class AmiEventDispatcher
{
    public static final String WILDCARD = "*";

    private final AmiStateTracker tracker;
    private final Clock clock;
    private final AmiObservabilitySink observabilitySink;

    private final Map<String, List<AmiEventHandler>> handlers = new ConcurrentHashMap<>();

    public AmiEventDispatcher(AmiStateTracker tracker, Clock clock, AmiObservabilitySink observabilitySink) {
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public void register(String eventName, AmiEventHandler handler) {
        Objects.requireNonNull(eventName, "eventName");
        Objects.requireNonNull(handler, "handler");
        handlers.computeIfAbsent(key(eventName), k -> new CopyOnWriteArrayList<>()).add(handler);
    }

    public boolean unregister(String eventName, AmiEventHandler handler) {
        List<AmiEventHandler> registered = handlers.get(key(eventName));
        return registered != null && registered.remove(handler);
    }

    /**
     * Deliver one message that belongs to connection {@code generation}.
     *
     * @return {@code false} if the message was dropped because its connection
     *         is no longer the current one
     */
    public boolean dispatch(long generation, AmiMessage message) {
        if (!tracker.isCurrent(generation)) {
            return false;
        }

        if (message.isEvent()) {
            tracker.apply(generation, message);
            deliver(key(message.name()), message);
        }
        deliver(WILDCARD, message);
        return true;
    }

    private void deliver(String key, AmiMessage message) {
        List<AmiEventHandler> registered = handlers.get(key);
        if (registered == null) {
            return;
        }
        for (AmiEventHandler handler : registered) {
            try {
                handler.onEvent(message);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable e) {
                observabilitySink.onError(new AmiErrorEvent(
                        clock.instant(),
                        "Event handler for '" + key + "' failed on " + message.name(),
                        e));
            }
        }
    }

    private static String key(String eventName) {
        return eventName.toLowerCase(Locale.ROOT);
    }
}
