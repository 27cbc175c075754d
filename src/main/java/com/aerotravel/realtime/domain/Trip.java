package com.aerotravel.realtime.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;

/**
 * A {@code trips} row as delivered by the change stream.
 */
public record Trip(
        String id,
        String tripCode,
        String packageId,
        LocalDate tripDate,
        String status,
        Integer totalPax,
        String departureTime,
        String updatedAt,
        JsonNode row
) implements RowRecord<Trip> {

    @Override
    public Trip withRow(JsonNode row) {
        return new Trip(id, tripCode, packageId, tripDate, status, totalPax, departureTime, updatedAt, row);
    }
}
