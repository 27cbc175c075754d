package com.aerotravel.realtime.config;

import java.time.Duration;
import java.util.Objects;

/**
 * RealtimeTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing for the realtime layer.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>statusPollInterval</b>: how often a binding re-checks
 *       {@code isSubscribed()} until the channel is confirmed. Consumers must not
 *       expect status to be fresher than this.</li>
 *   <li><b>joinTimeout</b>: how long the transport waits for a join reply
 *       before reporting {@code TIMED_OUT}.</li>
 *   <li><b>heartbeatInterval</b>: spacing of transport heartbeats.</li>
 * </ul>
 */
public record RealtimeTimingPolicy(
        Duration statusPollInterval,
        Duration joinTimeout,
        Duration heartbeatInterval
) {
    public RealtimeTimingPolicy {
        Objects.requireNonNull(statusPollInterval, "statusPollInterval");
        Objects.requireNonNull(joinTimeout, "joinTimeout");
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");

        if (statusPollInterval.isNegative() || statusPollInterval.isZero()) {
            throw new IllegalArgumentException("statusPollInterval must be positive");
        }
        if (joinTimeout.isNegative()) {
            throw new IllegalArgumentException("joinTimeout must be non-negative");
        }
        if (heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
            throw new IllegalArgumentException("heartbeatInterval must be positive");
        }
    }

    /**
     * Defaults: status poll 1000ms, join timeout 10s, heartbeat 25s.
     */
    public static RealtimeTimingPolicy defaults() {
        return new RealtimeTimingPolicy(
                Duration.ofMillis(1000),
                Duration.ofSeconds(10),
                Duration.ofSeconds(25)
        );
    }

    public RealtimeTimingPolicy withStatusPollInterval(Duration interval) {
        return new RealtimeTimingPolicy(interval, joinTimeout, heartbeatInterval);
    }
}
