package com.aerotravel.realtime.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffReconnectPolicyTest {

    @Test
    void delaysDoubleUntilCapped() {
        ExponentialBackoffReconnectPolicy policy = new ExponentialBackoffReconnectPolicy(
                Duration.ofMillis(100), Duration.ofMillis(500), 10, false);

        assertEquals(Optional.of(Duration.ofMillis(100)), policy.nextDelay(1));
        assertEquals(Optional.of(Duration.ofMillis(200)), policy.nextDelay(2));
        assertEquals(Optional.of(Duration.ofMillis(400)), policy.nextDelay(3));
        assertEquals(Optional.of(Duration.ofMillis(500)), policy.nextDelay(4));
        assertEquals(Optional.of(Duration.ofMillis(500)), policy.nextDelay(10));
    }

    @Test
    void givesUpPastMaxAttempts() {
        ExponentialBackoffReconnectPolicy policy = new ExponentialBackoffReconnectPolicy(
                Duration.ofMillis(100), Duration.ofSeconds(1), 3, false);

        assertTrue(policy.nextDelay(3).isPresent());
        assertTrue(policy.nextDelay(4).isEmpty());
        assertTrue(policy.nextDelay(0).isEmpty());
    }

    @Test
    void largeAttemptNumbersDoNotOverflow() {
        ExponentialBackoffReconnectPolicy policy = new ExponentialBackoffReconnectPolicy(
                Duration.ofMillis(100), Duration.ofSeconds(30), 100, false);

        assertEquals(Optional.of(Duration.ofSeconds(30)), policy.nextDelay(64));
    }

    @Test
    void jitterStaysWithinBounds() {
        ExponentialBackoffReconnectPolicy policy = new ExponentialBackoffReconnectPolicy(
                Duration.ofMillis(1000), Duration.ofMillis(4000), 5, true);

        for (int i = 0; i < 200; i++) {
            long ms = policy.nextDelay(2).orElseThrow().toMillis();
            assertTrue(ms >= 1000 && ms < 3000, "delay out of range: " + ms);
        }
    }

    @Test
    void rejectsInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () ->
                new ExponentialBackoffReconnectPolicy(Duration.ZERO, Duration.ofSeconds(1), 1, false));
        assertThrows(IllegalArgumentException.class, () ->
                new ExponentialBackoffReconnectPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1), 1, false));
        assertThrows(IllegalArgumentException.class, () ->
                new ExponentialBackoffReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1), 0, false));
    }

    @Test
    void noneNeverRetries() {
        assertTrue(ReconnectPolicy.none().nextDelay(1).isEmpty());
    }
}
