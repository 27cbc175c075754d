package com.aerotravel.realtime.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * One-shot task scheduler keyed on monotonic deadlines.
 *
 * <p>Periodic work (status polling, heartbeats) is expressed by re-arming a
 * fresh task from inside the running one, so every repetition can be
 * cancelled through the most recent {@link Cancellable}.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedule a task to run at or after the given monotonic deadline.
     *
     * @param deadlineNanos deadline in nanoseconds, on the {@link MonotonicClock} scale
     * @param task          task to run
     * @return cancellation handle
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedule a task to run once {@code delay} has elapsed on {@code clock}.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }

        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }
}
