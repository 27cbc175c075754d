package com.aerotravel.realtime.observability;

import com.aerotravel.realtime.api.ChannelName;
import com.aerotravel.realtime.api.ChannelStatus;

import java.time.Instant;

/**
 * A status transition reported by the transport for one channel.
 */
public record ChannelStatusEvent(
    Instant timestamp,
    ChannelName channel,
    String table,
    ChannelStatus status,
    Throwable cause
) {
}
