package com.aerotravel.realtime.api;

/**
 * Point-in-time connection state of a physical subscription.
 *
 * <p>Only {@link #JOINED} counts as subscribed.</p>
 */
public enum ChannelState
{
    CLOSED,
    ERRORED,
    JOINING,
    JOINED,
    LEAVING;

    public boolean isJoined()
    {
        return this == JOINED;
    }

    /**
     * Whether the subscription is live or on its way to being live.
     */
    public boolean isActive()
    {
        return this == JOINING || this == JOINED;
    }
}
