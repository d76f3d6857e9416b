package com.questrail.amilink.protocol.ami.observability;

import com.questrail.amilink.api.ConnectionState;

import java.time.Instant;

/**
 * A change of {@link ConnectionState}.
 *
 * @param generation connection generation the new state belongs to
 * @param reason     short human-readable cause, e.g. {@code "login accepted"}
 */
public record AmiConnectionTransitionEvent(
    Instant timestamp,
    ConnectionState oldState,
    ConnectionState newState,
    long generation,
    String reason
) {
    public boolean becameReady() {
        return newState == ConnectionState.READY && oldState != ConnectionState.READY;
    }

    public boolean lostReady() {
        return oldState == ConnectionState.READY && newState != ConnectionState.READY;
    }
}
