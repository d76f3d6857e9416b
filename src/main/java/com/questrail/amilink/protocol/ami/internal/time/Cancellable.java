package com.questrail.amilink.protocol.ami.internal.time;

/**
 * Handle for a task handed to a {@link MonotonicScheduler}.
 */
@FunctionalInterface
public interface Cancellable
{
    Cancellable NONE = () -> false;

    /**
     * @return {@code true} if this call prevented the task from running;
     *         {@code false} if it already ran or was already cancelled
     */
    boolean cancel();
}
