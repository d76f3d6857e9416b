package com.questrail.amilink.api;

import java.time.Instant;
import java.util.Objects;

/**
 * CallRecord
 * -----------------------------------------------------------------------------
 * Immutable view of one live call leg, keyed by its protocol-assigned
 * {@code uniqueid}.
 *
 * <p>{@code state} is carried verbatim from the switch (for example
 * {@code ringing}, {@code 6}, {@code Up}, {@code bridged}); it is not
 * normalized. {@code extension} is empty when the channel name does not
 * identify a local extension.</p>
 */
public record CallRecord(
        String uniqueid,
        String channel,
        String callerId,
        String destination,
        String context,
        String extension,
        String state,
        CallDirection direction,
        Instant createdAt
) {
    public CallRecord {
        Objects.requireNonNull(uniqueid, "uniqueid");
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(callerId, "callerId");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(extension, "extension");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    /**
     * Returns a copy with the lifecycle state replaced.
     */
    public CallRecord withState(String newState) {
        return new CallRecord(uniqueid, channel, callerId, destination, context,
                extension, newState, direction, createdAt);
    }
}
