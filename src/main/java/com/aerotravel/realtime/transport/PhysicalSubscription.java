package com.aerotravel.realtime.transport;

import com.aerotravel.realtime.api.ChannelState;

/**
 * One open subscription on a {@link RealtimeTransport}.
 */
public interface PhysicalSubscription
{
    /**
     * Current connection state; {@link ChannelState#JOINED} once the server confirmed.
     */
    ChannelState state();

    /**
     * Tear the subscription down. Returns immediately; the network side may
     * finish later. Idempotent.
     */
    void close();
}
