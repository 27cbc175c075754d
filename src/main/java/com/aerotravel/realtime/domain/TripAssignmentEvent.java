package com.aerotravel.realtime.domain;

import com.aerotravel.realtime.api.ChangeEvent;

/**
 * A guide assignment was inserted, updated or removed. For removals
 * {@code assignment} is the row as it was before deletion.
 */
public record TripAssignmentEvent(ChangeEvent changeType, TripAssignment assignment) {

    public boolean removed() {
        return changeType == ChangeEvent.DELETE;
    }
}
