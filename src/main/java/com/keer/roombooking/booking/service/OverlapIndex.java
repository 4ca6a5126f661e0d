package com.keer.roombooking.booking.service;

import com.keer.roombooking.booking.model.Booking;

import java.time.Instant;
import java.util.List;

/**
 * Answers whether a candidate interval collides with the occupying bookings of a room.
 */
public interface OverlapIndex {

    default boolean conflicts(Long roomId, Instant start, Instant end) {
        return conflicts(roomId, start, end, null);
    }

    boolean conflicts(Long roomId, Instant start, Instant end, Long excludeBookingId);

    List<Booking> findConflicts(Long roomId, Instant start, Instant end);
}
