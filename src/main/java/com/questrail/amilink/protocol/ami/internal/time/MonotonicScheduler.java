package com.questrail.amilink.protocol.ami.internal.time;

import java.time.Duration;

/**
 * MonotonicScheduler
 * =============================================================================
 * Deferred execution for everything time-driven in the client:
 * <ul>
 *   <li>failing an action whose response did not arrive in time</li>
 *   <li>the fixed backoff before an automatic reconnect</li>
 *   <li>the keep-alive ping cadence</li>
 * </ul>
 *
 * Delays are relative and measured on the scheduler's own {@link #clock()}, so
 * tests can swap in a manually advanced clock and run due tasks on demand.
 * Tasks must be short and must not block; they typically complete a future or
 * hand work to another thread.
 */
public interface MonotonicScheduler
{
    /**
     * Run {@code task} once, no earlier than {@code delay} from now.
     *
     * @throws IllegalArgumentException if {@code delay} is negative
     */
    Cancellable schedule(Duration delay, Runnable task);

    /**
     * The clock against which delays are measured.
     */
    MonotonicClock clock();
}
