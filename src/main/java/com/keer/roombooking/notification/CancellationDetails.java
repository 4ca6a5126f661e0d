package com.keer.roombooking.notification;

import java.time.Instant;

public record CancellationDetails(Long bookingId, String roomName, Instant startTime, String reason) {
}
