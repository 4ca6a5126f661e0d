package com.keer.roombooking.selection;

import com.keer.roombooking.booking.model.TimeInterval;

import java.util.List;

/**
 * Read-only copy of a room's occupied intervals as they were when the calendar was rendered.
 * Uses the same half-open rule as admission; a fresh admission may still disagree.
 */
public record AvailabilitySnapshot(Long roomId, List<TimeInterval> occupied) {

    public AvailabilitySnapshot {
        occupied = List.copyOf(occupied);
    }

    public static AvailabilitySnapshot empty(Long roomId) {
        return new AvailabilitySnapshot(roomId, List.of());
    }

    public boolean conflicts(TimeInterval candidate) {
        return occupied.stream().anyMatch(candidate::overlaps);
    }
}
