package com.aerotravel.realtime.internal.time;

/**
 * Cancellation handle for a task handed to a {@link MonotonicScheduler}.
 *
 * <p>Status polls, join timeouts, heartbeats and reconnect attempts are all
 * one-shot tasks; each owner keeps the handle and cancels it on teardown.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if this call prevented the task from running;
     *         {@code false} if it already ran or was cancelled before.
     */
    boolean cancel();
}
