package com.aerotravel.realtime.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A {@code bookings} row as delivered by the change stream. Absent columns are
 * {@code null}; columns without a component here stay readable through
 * {@link #row()}.
 */
public record Booking(
        String id,
        String bookingCode,
        String packageId,
        LocalDate tripDate,
        String status,
        String customerName,
        Integer adultPax,
        Integer childPax,
        Integer infantPax,
        BigDecimal totalAmount,
        String updatedAt,
        JsonNode row
) implements RowRecord<Booking> {

    @Override
    public Booking withRow(JsonNode row) {
        return new Booking(id, bookingCode, packageId, tripDate, status, customerName,
                adultPax, childPax, infantPax, totalAmount, updatedAt, row);
    }

    /**
     * Total head count, treating absent columns as zero.
     */
    public int totalPax() {
        return nz(adultPax) + nz(childPax) + nz(infantPax);
    }

    private static int nz(Integer value) {
        return value == null ? 0 : value;
    }
}
