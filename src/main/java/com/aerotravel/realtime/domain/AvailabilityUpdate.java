package com.aerotravel.realtime.domain;

import com.aerotravel.realtime.api.ChangeEvent;

import java.time.LocalDate;

/**
 * Signals that bookings for a package changed and availability should be
 * fetched again.
 *
 * <p>Slot and capacity figures are computed server-side; this event carries
 * them as zero and exists only to trigger the refetch.</p>
 */
public record AvailabilityUpdate(
        String packageId,
        LocalDate tripDate,
        ChangeEvent changeType,
        String bookingId,
        String bookingStatus,
        int availableSlots,
        int maxCapacity,
        int bookedSlots
) {
    public static AvailabilityUpdate changed(String packageId, LocalDate tripDate, ChangeEvent changeType,
                                             String bookingId, String bookingStatus) {
        return new AvailabilityUpdate(packageId, tripDate, changeType, bookingId, bookingStatus, 0, 0, 0);
    }
}
