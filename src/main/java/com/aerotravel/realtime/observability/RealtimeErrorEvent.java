package com.aerotravel.realtime.observability;

import com.aerotravel.realtime.api.ChannelName;

import java.time.Instant;

/**
 * An error or anomaly outside any consumer callback.
 *
 * @param channel the affected channel, or {@code null} when none applies
 */
public record RealtimeErrorEvent(
    Instant timestamp,
    String message,
    ChannelName channel,
    Throwable cause
) {
}
