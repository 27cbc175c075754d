package com.aerotravel.realtime.domain;

import com.aerotravel.realtime.api.ChangeEvent;
import com.aerotravel.realtime.api.ChannelConfig;
import com.aerotravel.realtime.api.ChannelName;
import com.aerotravel.realtime.api.RowChangePayload;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Signals booking activity on one package so availability can be refetched.
 *
 * <p>Channel {@code availability-<packageId>} (or
 * {@code availability-multi-<packageId>} when opened as part of a package list)
 * on {@code bookings}, every event type, filtered by {@code package_id}.</p>
 */
public final class AvailabilityAdapter extends DomainAdapter<AvailabilityUpdate> {

    private final String packageId;
    private final boolean batched;

    public AvailabilityAdapter(ObjectMapper mapper, String packageId) {
        this(mapper, packageId, false);
    }

    /**
     * @param batched {@code true} to use the {@code availability-multi-} channel prefix
     */
    public AvailabilityAdapter(ObjectMapper mapper, String packageId, boolean batched) {
        super(mapper);
        this.packageId = requireId(packageId, "packageId");
        this.batched = batched;
    }

    @Override
    public ChannelName channelName() {
        return ChannelName.of(batched ? "availability-multi" : "availability", packageId);
    }

    @Override
    public ChannelConfig config() {
        return ChannelConfig.of("bookings", ChangeEvent.ALL, ChannelConfig.eq("package_id", packageId));
    }

    @Override
    public Optional<AvailabilityUpdate> transform(RowChangePayload<JsonNode> payload) {
        Booking booking = readRow(payload.latestImage(), Booking.class);
        return Optional.of(AvailabilityUpdate.changed(
                packageId, booking.tripDate(), payload.eventType(), booking.id(), booking.status()));
    }
}
