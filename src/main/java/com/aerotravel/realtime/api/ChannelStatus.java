package com.aerotravel.realtime.api;

/**
 * Status transitions reported by the transport for one physical subscription.
 */
public enum ChannelStatus
{
    /** The server confirmed the subscription. */
    SUBSCRIBED,

    /** The server rejected the subscription or the connection failed. */
    CHANNEL_ERROR,

    /** No confirmation arrived within the join timeout. */
    TIMED_OUT,

    /** The subscription was closed, by either side. */
    CLOSED;

    public boolean isFailure()
    {
        return this == CHANNEL_ERROR || this == TIMED_OUT;
    }
}
