package com.keer.roombooking.selection;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One granule of one day; {@code index} counts granules from opening time.
 */
public record GridCell(LocalDate date, int index) {

    public GridCell {
        Objects.requireNonNull(date, "date");
        if (index < 0) {
            throw new IllegalArgumentException("Granule index must not be negative: " + index);
        }
    }
}
