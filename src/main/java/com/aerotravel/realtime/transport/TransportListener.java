package com.aerotravel.realtime.transport;

import com.aerotravel.realtime.api.ChannelStatus;
import com.aerotravel.realtime.api.RowChangePayload;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Callback sink for one {@link PhysicalSubscription}.
 *
 * <p>Callbacks for a given subscription are serialized by the transport.</p>
 */
public interface TransportListener
{
    /**
     * A row change matching the subscription predicate.
     */
    void onRowChange(RowChangePayload<JsonNode> payload);

    /**
     * A status transition.
     *
     * @param cause diagnostic detail for failures; {@code null} otherwise
     */
    void onStatus(ChannelStatus status, Throwable cause);
}
