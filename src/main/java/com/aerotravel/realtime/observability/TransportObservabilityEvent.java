package com.aerotravel.realtime.observability;

import java.time.Instant;

/**
 * Socket-level transition of the shared transport connection.
 *
 * @param cause {@code null} for an orderly transition
 */
public record TransportObservabilityEvent(
    Instant timestamp,
    boolean up,
    Throwable cause
) {
}
