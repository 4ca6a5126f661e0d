package com.keer.roombooking.booking.event;

import java.time.Instant;

/**
 * Published inside the cancelling transaction; listeners act after commit.
 */
public record BookingCancelledEvent(
        Long bookingId,
        Long ownerId,
        String roomName,
        Instant startTime,
        Instant endTime,
        String reason
) {
}
