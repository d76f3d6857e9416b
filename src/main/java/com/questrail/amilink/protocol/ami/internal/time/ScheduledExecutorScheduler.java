package com.questrail.amilink.protocol.ami.internal.time;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a {@link ScheduledExecutorService}.
 *
 * <h2>Executor ownership</h2>
 * The executor is owned by the composition root
 * ({@code AmiClientRuntime}); this class never shuts it down.
 *
 * <h2>After shutdown</h2>
 * Once the executor stops accepting work, scheduling becomes a no-op that
 * returns {@link Cancellable#NONE}.
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler
{
    private static final Logger log = LoggerFactory.getLogger(ScheduledExecutorScheduler.class);

    private final ScheduledExecutorService executor;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public Cancellable schedule(Duration delay, Runnable task) {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(task, "task");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        final ScheduledFuture<?> future;
        try {
            future = executor.schedule(task, delay.toNanos(), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler is shut down; dropping task scheduled in {}", delay);
            return Cancellable.NONE;
        }
        return () -> future.cancel(false);
    }

    @Override
    public MonotonicClock clock() {
        return SystemMonotonicClock.INSTANCE;
    }
}
