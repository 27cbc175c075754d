package com.aerotravel.realtime.api;

import java.util.Objects;

/**
 * Surfaced as {@link SubscriptionState#error()} when the transport reports
 * {@code CHANNEL_ERROR} or {@code TIMED_OUT} for a bound channel.
 */
public class ChannelFailureException extends RuntimeException
{
    private final ChannelName channel;
    private final ChannelStatus status;

    public ChannelFailureException(ChannelName channel, ChannelStatus status)
    {
        super("Channel " + channel + " reported " + status);
        this.channel = Objects.requireNonNull(channel, "channel");
        this.status = Objects.requireNonNull(status, "status");
    }

    public ChannelName channel()
    {
        return channel;
    }

    public ChannelStatus status()
    {
        return status;
    }
}
