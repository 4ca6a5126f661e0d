package com.keer.roombooking.booking.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Half-open interval {@code [start, end)}. Touching intervals do not overlap.
 */
public record TimeInterval(Instant start, Instant end) {

    public TimeInterval {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Interval start " + start + " must be before end " + end);
        }
    }

    public boolean overlaps(TimeInterval other) {
        return overlaps(other.start, other.end);
    }

    public boolean overlaps(Instant otherStart, Instant otherEnd) {
        return start.isBefore(otherEnd) && end.isAfter(otherStart);
    }
}
