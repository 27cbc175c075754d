package com.aerotravel.realtime.core;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Reconnect policy using exponential backoff.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay};
 * with jitter enabled the result is scaled by a random factor in [0.5, 1.5) and
 * capped again. Gives up once {@code attempt} exceeds {@code maxAttempts}.</p>
 */
public final class ExponentialBackoffReconnectPolicy implements ReconnectPolicy {
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final int maxAttempts;
    private final boolean jitter;

    public ExponentialBackoffReconnectPolicy(Duration baseDelay, Duration maxDelay, int maxAttempts, boolean jitter) {
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be > 0, got: " + baseDelay);
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay, got: " + maxDelay);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        this.baseDelayMs = baseDelay.toMillis();
        this.maxDelayMs = maxDelay.toMillis();
        this.maxAttempts = maxAttempts;
        this.jitter = jitter;
    }

    @Override
    public Optional<Duration> nextDelay(int attempt) {
        if (attempt < 1 || attempt > maxAttempts) {
            return Optional.empty();
        }
        long expDelay;
        if (attempt >= 31) {
            expDelay = Long.MAX_VALUE;
        } else {
            long shift = 1L << (attempt - 1);
            expDelay = (shift > maxDelayMs / baseDelayMs) ? Long.MAX_VALUE : baseDelayMs * shift;
        }
        long capped = Math.min(maxDelayMs, expDelay);
        if (jitter) {
            double factor = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
            capped = Math.min(maxDelayMs, Math.max(0L, (long) (capped * factor)));
        }
        return Optional.of(Duration.ofMillis(capped));
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
