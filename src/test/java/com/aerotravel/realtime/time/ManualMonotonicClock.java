package com.aerotravel.realtime.time;

import com.aerotravel.realtime.internal.time.MonotonicClock;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hand-driven {@link MonotonicClock} for tests. Starts at zero and moves only
 * through {@link #advance(Duration)} or {@link #advanceMillis(long)}.
 */
public final class ManualMonotonicClock implements MonotonicClock {

    private final AtomicLong elapsedNanos = new AtomicLong();

    @Override
    public long nowNanos() {
        return elapsedNanos.get();
    }

    public void advance(Duration step) {
        if (step.isNegative()) {
            throw new IllegalArgumentException("monotonic time cannot run backwards: " + step);
        }
        elapsedNanos.addAndGet(step.toNanos());
    }

    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    /**
     * Time elapsed since the clock was created.
     */
    public Duration elapsed() {
        return Duration.ofNanos(elapsedNanos.get());
    }
}
