package com.aerotravel.realtime.core;

import com.aerotravel.realtime.api.ChannelName;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Consecutive failed-subscription counter per channel.
 *
 * - Incremented on CHANNEL_ERROR / TIMED_OUT
 * - Reset on SUBSCRIBED and on unsubscribe
 * - Does not encode reconnect policy
 */
public final class ReconnectAttemptTracker {

    private final ConcurrentMap<ChannelName, Integer> attempts = new ConcurrentHashMap<>();

    /**
     * @return the updated attempt count
     */
    public int recordFailure(ChannelName channel) {
        return attempts.merge(channel, 1, Integer::sum);
    }

    public void reset(ChannelName channel) {
        attempts.remove(channel);
    }

    /**
     * Current attempt count (0 if none).
     */
    public int attemptsFor(ChannelName channel) {
        return attempts.getOrDefault(channel, 0);
    }
}
