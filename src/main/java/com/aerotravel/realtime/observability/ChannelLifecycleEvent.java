package com.aerotravel.realtime.observability;

import com.aerotravel.realtime.api.ChannelName;

import java.time.Duration;
import java.time.Instant;

/**
 * Pool-level lifecycle step for one channel.
 *
 * @param delay only set for {@link Kind#RECONNECT_SCHEDULED}
 */
public record ChannelLifecycleEvent(
    Instant timestamp,
    ChannelName channel,
    String table,
    Kind kind,
    int attempt,
    Duration delay
) {
    public enum Kind {
        CREATED,
        REUSED,
        UNSUBSCRIBED,
        RECONNECT_SCHEDULED,
        RECONNECT_EXHAUSTED
    }

    public static ChannelLifecycleEvent of(Instant timestamp, ChannelName channel, String table, Kind kind) {
        return new ChannelLifecycleEvent(timestamp, channel, table, kind, 0, null);
    }
}
