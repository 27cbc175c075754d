package com.aerotravel.realtime.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used to timestamp observability records. Never used for
 * timeouts or cadence.
 */
public interface WallClock
{
    Instant now();
}
