package com.aerotravel.realtime.observability;

import com.aerotravel.realtime.api.ChangeEvent;
import com.aerotravel.realtime.api.ChannelName;

import java.time.Instant;

/**
 * A consumer callback threw while handling a payload. Delivery continued.
 */
public record CallbackErrorEvent(
    Instant timestamp,
    ChannelName channel,
    String table,
    ChangeEvent eventType,
    Throwable cause
) {
}
