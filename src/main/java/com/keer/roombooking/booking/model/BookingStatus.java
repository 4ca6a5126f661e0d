package com.keer.roombooking.booking.model;

import java.util.Set;

public enum BookingStatus {

    CONFIRMED,
    CANCELLED,
    COMPLETED;

    /**
     * Statuses that hold their interval on the room timeline. Completed bookings keep
     * participating so that history stays free of overlaps.
     */
    public static final Set<BookingStatus> OCCUPYING = Set.of(CONFIRMED, COMPLETED);

    // Only CONFIRMED moves, and never back to itself.
    public boolean canTransitionTo(BookingStatus target) {
        return this == CONFIRMED && target != CONFIRMED;
    }
}
