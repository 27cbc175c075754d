package com.aerotravel.realtime.transport;

import com.aerotravel.realtime.api.ChannelConfig;
import com.aerotravel.realtime.api.ChannelName;

/**
 * RealtimeTransport
 * -----------------------------------------------------------------------------
 * Port to the push service that streams row changes.
 *
 * <p>One call to {@link #open} creates one physical subscription for a
 * (schema, table, event, filter) predicate. The transport then reports, through
 * the supplied {@link TransportListener}:</p>
 * <ul>
 *   <li>a {@code RowChangePayload} for every matching row change, in the order
 *       the server emitted them</li>
 *   <li>status transitions: {@code SUBSCRIBED}, {@code CHANNEL_ERROR},
 *       {@code TIMED_OUT}, {@code CLOSED}</li>
 * </ul>
 *
 * <p>Nothing else is asked of a transport: no acknowledgements, no replay, no
 * transactions. Deduplication of subscriptions is the pool's job, not the
 * transport's.</p>
 *
 * <p>Implementations must not invoke listener callbacks while holding a lock
 * that {@link #open} or {@link PhysicalSubscription#close()} also takes;
 * listeners call back into the pool.</p>
 */
public interface RealtimeTransport
{
    /**
     * Open a physical subscription. Returns immediately; confirmation arrives
     * later as a {@code SUBSCRIBED} status.
     *
     * @throws RealtimeTransportException if the subscription cannot even be requested
     */
    PhysicalSubscription open(ChannelName name, ChannelConfig config, TransportListener listener);
}
