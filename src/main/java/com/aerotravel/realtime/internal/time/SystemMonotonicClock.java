package com.aerotravel.realtime.internal.time;

/**
 * Production {@link MonotonicClock} reading {@link System#nanoTime()}.
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
