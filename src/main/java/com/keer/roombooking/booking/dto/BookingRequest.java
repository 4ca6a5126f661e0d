package com.keer.roombooking.booking.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BookingRequest {

    @NotNull(message = "roomId is required")
    private Long roomId;

    @NotNull(message = "startTime is required")
    private Instant startTime;

    @NotNull(message = "endTime is required")
    private Instant endTime;

    @Size(max = 500, message = "purpose must be at most 500 characters")
    private String purpose;

    @Size(max = 10, message = "at most 10 attendees are allowed")
    private List<@Valid @NotNull(message = "attendee entries must not be null") AttendeeDto> attendees = new ArrayList<>();
}
