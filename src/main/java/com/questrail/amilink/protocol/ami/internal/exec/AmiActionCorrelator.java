package com.questrail.amilink.protocol.ami.internal.exec;

import com.questrail.amilink.api.ActionTimeoutException;
import com.questrail.amilink.protocol.ami.internal.time.MonotonicScheduler;
import com.questrail.amilink.protocol.ami.model.AmiMessage;
import com.questrail.amilink.protocol.ami.model.AmiResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * AmiActionCorrelator
 * =============================================================================
 * Pairs outbound actions with their responses on one shared connection.
 *
 * <h2>Why correlation tokens</h2>
 * Events are unsolicited and may arrive between an action and its response,
 * and several callers may have actions in flight at once. The next block after
 * a write is therefore not necessarily its response. Every action gets a fresh
 * {@code ActionID}; a response resolves an action only when it echoes that
 * exact token.
 *
 * <h2>Inbound contract</h2>
 * <ul>
 *   <li>{@link #onResponse(AmiMessage)} returns {@code true} when it consumed the
 *       response. Anything it returns {@code false} for must be forwarded to the
 *       event dispatcher so it is not silently lost.</li>
 *   <li>{@link #onEvent(AmiMessage)} collects events that belong to an
 *       event-list action. It never consumes them; events are always dispatched
 *       as well.</li>
 * </ul>
 *
 * <h2>Timeouts</h2>
 * Each registration arms a timer on the {@link MonotonicScheduler}. When it
 * fires first, the action fails with {@link ActionTimeoutException}, its slot
 * is released at once, and its token joins a bounded set of expired tokens so
 * that a late response is recognized and discarded.
 *
 * <h2>Thread Safety</h2>
 * Registration happens on caller threads, matching on the inbound thread and
 * expiry on the scheduler thread. The pending table is concurrent and every
 * completion goes through {@code remove(token, pending)}, so each action is
 * completed exactly once.
 */
public final class AmiActionCorrelator
{
    private static final Logger log = LoggerFactory.getLogger(AmiActionCorrelator.class);

    static final int EXPIRED_TOKEN_MEMORY = 1024;

    private final String tokenPrefix;
    private final MonotonicScheduler scheduler;
    private final Duration timeout;

    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, PendingAction> pending = new ConcurrentHashMap<>();
    private final Set<String> expired = Collections.newSetFromMap(
            Collections.synchronizedMap(new LinkedHashMap<String, Boolean>(64, 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                    return size() > EXPIRED_TOKEN_MEMORY;
                }
            }));

    /**
     * @param tokenPrefix prefix that makes tokens unique across connections,
     *                    e.g. the connection generation
     * @param scheduler   scheduler used for response deadlines
     * @param timeout     deadline applied to every action
     */
    public AmiActionCorrelator(String tokenPrefix, MonotonicScheduler scheduler, Duration timeout) {
        this.tokenPrefix = Objects.requireNonNull(tokenPrefix, "tokenPrefix");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /**
     * Register a new in-flight action under a fresh token and arm its deadline.
     * Must be called before the action is written, so that a response arriving
     * immediately still finds its entry.
     */
    public PendingAction register(String actionName) {
        String token = tokenPrefix + "-" + sequence.incrementAndGet();
        PendingAction action = new PendingAction(actionName, token, scheduler.clock().nowNanos());
        pending.put(token, action);
        action.armTimeout(scheduler.schedule(timeout, () -> expire(action)));
        return action;
    }

    /**
     * Fail a registered action that never made it onto the wire.
     */
    public void abandon(PendingAction action, Throwable cause) {
        if (pending.remove(action.actionId(), action)) {
            action.disarmTimeout();
            action.future().completeExceptionally(cause);
        }
    }

    /**
     * @return {@code true} if the response belonged to an outstanding (or
     *         recently expired) action and must not be dispatched
     */
    public boolean onResponse(AmiMessage response) {
        Optional<String> token = response.actionId();
        if (token.isEmpty()) {
            return false;
        }

        PendingAction action = pending.get(token.get());
        if (action == null) {
            if (expired.remove(token.get())) {
                log.debug("Discarding late response for expired ActionID {}", token.get());
                return true;
            }
            return false;
        }

        if (response.isEventListStart() && !action.collectingEventList()) {
            action.startEventList(response);
            return true;
        }

        complete(action, AmiResponse.of(response));
        return true;
    }

    /**
     * Offer an event to a pending event-list action.
     */
    public void onEvent(AmiMessage event) {
        Optional<String> token = event.actionId();
        if (token.isEmpty()) {
            return;
        }
        PendingAction action = pending.get(token.get());
        if (action == null || !action.collectingEventList()) {
            return;
        }
        action.addListEvent(event);
        if (event.isEventListComplete()) {
            complete(action, action.completedList());
        }
    }

    /**
     * Fail every outstanding action. Used when the connection goes away.
     *
     * @return the number of actions cancelled
     */
    public int cancelAll(Throwable cause) {
        List<PendingAction> snapshot = new ArrayList<>(pending.values());
        int cancelled = 0;
        for (PendingAction action : snapshot) {
            if (pending.remove(action.actionId(), action)) {
                action.disarmTimeout();
                action.future().completeExceptionally(cause);
                cancelled++;
            }
        }
        return cancelled;
    }

    public int outstanding() {
        return pending.size();
    }

    private void complete(PendingAction action, AmiResponse response) {
        if (pending.remove(action.actionId(), action)) {
            action.disarmTimeout();
            action.future().complete(response);
        }
    }

    private void expire(PendingAction action) {
        // Remembered before removal so a response racing the timer is still discarded.
        expired.add(action.actionId());
        if (!pending.remove(action.actionId(), action)) {
            expired.remove(action.actionId());
        } else {
            log.debug("Action {} (ActionID {}) expired after {}", action.actionName(), action.actionId(), timeout);
            action.future().completeExceptionally(
                    new ActionTimeoutException(action.actionName(), action.actionId(), timeout));
        }
    }
}
