package com.questrail.amilink.protocol.ami.internal.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * Tests for the production scheduler implementation.
 *
 * Note: These tests use real time. Tolerances are set generously to avoid
 * false failures on loaded machines.
 */
class ScheduledExecutorSchedulerTest {

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void taskExecutesAfterDelay() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);
        long start = scheduler.clock().nowNanos();

        scheduler.schedule(Duration.ofMillis(50), latch::countDown);

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        long elapsed = scheduler.clock().nowNanos() - start;
        assertTrue(elapsed >= TimeUnit.MILLISECONDS.toNanos(45), "ran too early: " + elapsed);
    }

    @Test
    void cancelledTaskDoesNotRun() throws InterruptedException {
        AtomicBoolean ran = new AtomicBoolean(false);

        Cancellable handle = scheduler.schedule(Duration.ofMillis(100), () -> ran.set(true));
        assertTrue(handle.cancel());
        assertFalse(handle.cancel());

        Thread.sleep(200);
        assertFalse(ran.get());
    }

    @Test
    void negativeDelayIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> scheduler.schedule(Duration.ofMillis(-1), () -> {}));
    }

    @Test
    void schedulingAfterShutdownIsNoOp() {
        executor.shutdown();

        Cancellable handle = scheduler.schedule(Duration.ofMillis(10), () -> fail("must not run"));

        assertSame(Cancellable.NONE, handle);
    }
}
