package com.aerotravel.realtime.domain;

import com.aerotravel.realtime.api.ChangeEvent;
import com.aerotravel.realtime.api.ChannelConfig;
import com.aerotravel.realtime.api.ChannelName;
import com.aerotravel.realtime.api.RowChangePayload;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Follows status updates of one trip: channel {@code trip-<id>} on
 * {@code trips}, UPDATE only.
 */
public final class TripStatusAdapter extends DomainAdapter<Trip> {

    private final String tripId;

    public TripStatusAdapter(ObjectMapper mapper, String tripId) {
        super(mapper);
        this.tripId = requireId(tripId, "tripId");
    }

    public String tripId() {
        return tripId;
    }

    @Override
    public ChannelName channelName() {
        return ChannelName.of("trip", tripId);
    }

    @Override
    public ChannelConfig config() {
        return ChannelConfig.of("trips", ChangeEvent.UPDATE, ChannelConfig.eq("id", tripId));
    }

    @Override
    public Optional<Trip> transform(RowChangePayload<JsonNode> payload) {
        return payload.newImage().map(row -> readFullRow(row, Trip.class));
    }
}
