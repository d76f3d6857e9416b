package com.questrail.amilink.protocol.ami.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for action deadlines, reconnect backoff and keep-alive cadence.
 *
 * <p>Values only mean something relative to each other. Wall-clock time is used
 * for record timestamps and logging, never for deciding when something expires.</p>
 */
@FunctionalInterface
public interface MonotonicClock
{
    /**
     * @return a tick count in nanoseconds that never decreases
     */
    long nowNanos();
}
