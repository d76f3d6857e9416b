package com.questrail.amilink.protocol.ami.internal.time;

/**
 * {@link MonotonicClock} backed by {@link System#nanoTime()}.
 */
public enum SystemMonotonicClock implements MonotonicClock
{
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
