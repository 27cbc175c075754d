package com.aerotravel.realtime.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;

/**
 * A {@code trip_guides} row: one guide assigned to one trip.
 */
public record TripAssignment(
        String id,
        String tripId,
        String guideId,
        String guideRole,
        String assignmentStatus,
        BigDecimal feeAmount,
        String assignedAt,
        String confirmedAt,
        String rejectedAt,
        String rejectionReason,
        JsonNode row
) implements RowRecord<TripAssignment> {

    @Override
    public TripAssignment withRow(JsonNode row) {
        return new TripAssignment(id, tripId, guideId, guideRole, assignmentStatus, feeAmount,
                assignedAt, confirmedAt, rejectedAt, rejectionReason, row);
    }
}
