package com.aerotravel.realtime.core;

import java.time.Duration;
import java.util.Optional;

/**
 * Decides whether, and after how long, a failed channel is opened again.
 *
 * <p>The pool consults the policy after every {@code CHANNEL_ERROR} or
 * {@code TIMED_OUT}. The default is {@link #none()}: failures are reported and
 * the channel stays down until its owner subscribes again.</p>
 */
@FunctionalInterface
public interface ReconnectPolicy {

    /**
     * @param attempt consecutive failed attempts so far, starting at 1
     * @return the delay before the next attempt, or empty to give up
     */
    Optional<Duration> nextDelay(int attempt);

    static ReconnectPolicy none() {
        return attempt -> Optional.empty();
    }

    /**
     * Exponential backoff with jitter, capped at {@code maxDelay} and
     * {@code maxAttempts}.
     */
    static ReconnectPolicy exponentialBackoff(Duration baseDelay, Duration maxDelay, int maxAttempts) {
        return new ExponentialBackoffReconnectPolicy(baseDelay, maxDelay, maxAttempts, true);
    }
}
