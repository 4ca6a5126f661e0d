package com.keer.roombooking.booking.service;

import com.keer.roombooking.booking.model.Attendee;

import java.time.Instant;
import java.util.List;

public record AdmissionRequest(
        Long roomId,
        Long ownerId,
        Instant start,
        Instant end,
        String purpose,
        List<Attendee> attendees
) {
    public AdmissionRequest {
        attendees = attendees == null ? List.of() : List.copyOf(attendees);
    }
}
