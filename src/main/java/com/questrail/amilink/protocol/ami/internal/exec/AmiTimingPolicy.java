package com.questrail.amilink.protocol.ami.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * AmiTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for the client. Pure scheduling knobs; none of them
 * changes what a message means.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>actionTimeout</b>: how long an action waits for the response that
 *       carries its {@code ActionID}. For event-list actions this covers the
 *       whole list.</li>
 *   <li><b>reconnectBackoff</b>: fixed pause between a disconnect and the next
 *       connect attempt, both for {@code reconnect()} and automatic recovery.</li>
 *   <li><b>pingInterval</b>: keep-alive cadence while ready. {@link Duration#ZERO}
 *       disables keep-alive.</li>
 * </ul>
 */
public record AmiTimingPolicy(
        Duration actionTimeout,
        Duration reconnectBackoff,
        Duration pingInterval
) {
    public AmiTimingPolicy {
        Objects.requireNonNull(actionTimeout, "actionTimeout");
        Objects.requireNonNull(reconnectBackoff, "reconnectBackoff");
        Objects.requireNonNull(pingInterval, "pingInterval");

        if (actionTimeout.isNegative() || actionTimeout.isZero()) {
            throw new IllegalArgumentException("actionTimeout must be positive");
        }
        if (reconnectBackoff.isNegative()) {
            throw new IllegalArgumentException("reconnectBackoff must be non-negative");
        }
        if (pingInterval.isNegative()) {
            throw new IllegalArgumentException("pingInterval must be non-negative");
        }
    }

    public boolean keepAliveEnabled() {
        return !pingInterval.isZero();
    }

    /**
     * Defaults: 10 s action timeout, 2 s reconnect backoff, 60 s ping.
     */
    public static AmiTimingPolicy defaults() {
        return new AmiTimingPolicy(
                Duration.ofSeconds(10),
                Duration.ofSeconds(2),
                Duration.ofSeconds(60)
        );
    }

    /**
     * A policy with the given action timeout, no backoff and no keep-alive.
     * Handy for tests that exercise correlation only.
     */
    public static AmiTimingPolicy withActionTimeout(Duration actionTimeout) {
        return new AmiTimingPolicy(actionTimeout, Duration.ZERO, Duration.ZERO);
    }
}
