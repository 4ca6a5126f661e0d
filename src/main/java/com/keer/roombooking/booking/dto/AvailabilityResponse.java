package com.keer.roombooking.booking.dto;

import com.keer.roombooking.selection.AvailabilitySnapshot;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AvailabilityResponse {

    private Long roomId;

    private LocalDate date;

    private List<Slot> occupied;

    public static AvailabilityResponse from(LocalDate date, AvailabilitySnapshot snapshot) {
        List<Slot> slots = snapshot.occupied().stream()
                .map(interval -> new Slot(interval.start(), interval.end()))
                .toList();
        return new AvailabilityResponse(snapshot.roomId(), date, slots);
    }

    public record Slot(Instant startTime, Instant endTime) {
    }
}
