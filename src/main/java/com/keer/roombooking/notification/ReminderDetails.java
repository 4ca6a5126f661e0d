package com.keer.roombooking.notification;

import java.time.Instant;

public record ReminderDetails(Long bookingId, String roomName, Instant startTime, Instant endTime) {
}
