package com.questrail.amilink.protocol.ami.internal.exec;

import com.questrail.amilink.protocol.ami.internal.time.Cancellable;
import com.questrail.amilink.protocol.ami.model.AmiMessage;
import com.questrail.amilink.protocol.ami.model.AmiResponse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * PendingAction
 * =============================================================================
 * One in-flight action, owned by {@link AmiActionCorrelator} from registration
 * until it is fulfilled, times out or is cancelled.
 *
 * <p>The {@link #future()} is the single fulfillment slot. Whoever removes the
 * entry from the correlator's table completes it; every other party loses the
 * race and does nothing.</p>
 *
 * <p>The event-list fields are touched only from the inbound thread of the
 * connection.</p>
 */
public final class PendingAction
{
    private final String actionName;
    private final String actionId;
    private final long issuedAtNanos;
    private final CompletableFuture<AmiResponse> future = new CompletableFuture<>();

    private volatile Cancellable timeout = Cancellable.NONE;

    private AmiMessage listResponse;
    private final List<AmiMessage> listEvents = new ArrayList<>();

    PendingAction(String actionName, String actionId, long issuedAtNanos) {
        this.actionName = Objects.requireNonNull(actionName, "actionName");
        this.actionId = Objects.requireNonNull(actionId, "actionId");
        this.issuedAtNanos = issuedAtNanos;
    }

    public String actionName() {
        return actionName;
    }

    public String actionId() {
        return actionId;
    }

    public long issuedAtNanos() {
        return issuedAtNanos;
    }

    public CompletableFuture<AmiResponse> future() {
        return future;
    }

    void armTimeout(Cancellable timeout) {
        this.timeout = timeout;
    }

    void disarmTimeout() {
        timeout.cancel();
    }

    boolean collectingEventList() {
        return listResponse != null;
    }

    void startEventList(AmiMessage response) {
        this.listResponse = response;
    }

    void addListEvent(AmiMessage event) {
        listEvents.add(event);
    }

    AmiResponse completedList() {
        return new AmiResponse(listResponse, listEvents);
    }
}
