package com.aerotravel.realtime.internal.time;

/**
 * Time source for every timing decision in the realtime layer.
 *
 * <p>Poll cadence, join timeouts and reconnect spacing are computed from this
 * clock only. Wall-clock instants are used for observability records and
 * nothing else.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * differences between two readings are meaningful.
     */
    long nowNanos();
}
