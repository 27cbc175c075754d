package com.aerotravel.realtime.domain;

import com.aerotravel.realtime.api.ChangeEvent;
import com.aerotravel.realtime.api.ChannelConfig;
import com.aerotravel.realtime.api.ChannelName;
import com.aerotravel.realtime.api.RowChangePayload;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Follows guide assignments of one trip.
 *
 * <p>Channel {@code trip-assignment-<tripId>} on {@code trip_guides}, every
 * event type. Inserts and updates report the new row; deletes report the old
 * row.</p>
 */
public final class TripAssignmentAdapter extends DomainAdapter<TripAssignmentEvent> {

    private final String tripId;

    public TripAssignmentAdapter(ObjectMapper mapper, String tripId) {
        super(mapper);
        this.tripId = requireId(tripId, "tripId");
    }

    @Override
    public ChannelName channelName() {
        return ChannelName.of("trip-assignment", tripId);
    }

    @Override
    public ChannelConfig config() {
        return ChannelConfig.of("trip_guides", ChangeEvent.ALL, ChannelConfig.eq("trip_id", tripId));
    }

    @Override
    public Optional<TripAssignmentEvent> transform(RowChangePayload<JsonNode> payload) {
        TripAssignment assignment = readFullRow(payload.latestImage(), TripAssignment.class);
        return Optional.of(new TripAssignmentEvent(payload.eventType(), assignment));
    }
}
