package com.aerotravel.realtime.domain;

import com.aerotravel.realtime.api.ChangeEvent;
import com.aerotravel.realtime.api.ChannelConfig;
import com.aerotravel.realtime.api.ChannelName;
import com.aerotravel.realtime.api.RowChangePayload;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Follows status updates of one booking.
 *
 * <p>Channel {@code booking-<id>} on {@code bookings}, UPDATE only, filtered to
 * the booking's id. Each update yields the new row.</p>
 */
public final class BookingStatusAdapter extends DomainAdapter<Booking> {

    private final String bookingId;

    public BookingStatusAdapter(ObjectMapper mapper, String bookingId) {
        super(mapper);
        this.bookingId = requireId(bookingId, "bookingId");
    }

    public String bookingId() {
        return bookingId;
    }

    @Override
    public ChannelName channelName() {
        return ChannelName.of("booking", bookingId);
    }

    @Override
    public ChannelConfig config() {
        return ChannelConfig.of("bookings", ChangeEvent.UPDATE, ChannelConfig.eq("id", bookingId));
    }

    @Override
    public Optional<Booking> transform(RowChangePayload<JsonNode> payload) {
        return payload.newImage().map(row -> readFullRow(row, Booking.class));
    }
}
