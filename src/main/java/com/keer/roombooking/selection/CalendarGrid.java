package com.keer.roombooking.selection;

import com.keer.roombooking.booking.model.TimeInterval;
import com.keer.roombooking.booking.policy.BookingPolicyProperties;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Set;

/**
 * Daily operating window quantised into fixed granules.
 */
public final class CalendarGrid {

    public static final Duration DEFAULT_GRANULE = Duration.ofMinutes(15);

    private final int openingHour;
    private final int closingHour;
    private final Duration granule;
    private final ZoneId zone;
    private final Set<DayOfWeek> closedDays;

    public CalendarGrid(int openingHour, int closingHour, Duration granule, ZoneId zone, Set<DayOfWeek> closedDays) {
        if (openingHour < 0 || closingHour > 23 || openingHour >= closingHour) {
            throw new IllegalArgumentException("Invalid operating hours " + openingHour + "-" + closingHour);
        }
        if (granule.isZero() || granule.isNegative() || Duration.ofHours(1).toMinutes() % granule.toMinutes() != 0) {
            throw new IllegalArgumentException("Granule must evenly divide an hour: " + granule);
        }
        this.openingHour = openingHour;
        this.closingHour = closingHour;
        this.granule = granule;
        this.zone = zone;
        this.closedDays = closedDays.isEmpty() ? EnumSet.noneOf(DayOfWeek.class) : EnumSet.copyOf(closedDays);
    }

    public static CalendarGrid from(BookingPolicyProperties policy) {
        return new CalendarGrid(policy.getOpeningHour(), policy.getClosingHour(), DEFAULT_GRANULE,
                policy.getZone(), policy.getClosedDays());
    }

    public int granulesPerDay() {
        return (int) (Duration.ofHours(closingHour - openingHour).toMinutes() / granule.toMinutes());
    }

    public boolean contains(GridCell cell) {
        return cell.index() < granulesPerDay();
    }

    public boolean isClosed(LocalDate date) {
        return closedDays.contains(date.getDayOfWeek());
    }

    public Instant startOf(GridCell cell) {
        return openingOf(cell.date()).plus(granule.multipliedBy(cell.index()));
    }

    /**
     * The single-granule interval covered by {@code cell}.
     */
    public TimeInterval intervalOf(GridCell cell) {
        Instant start = startOf(cell);
        return new TimeInterval(start, start.plus(granule));
    }

    /**
     * {@code [min(a, b), max(a, b) + granule)}; both cells must share a day.
     */
    public TimeInterval span(GridCell a, GridCell b) {
        if (!a.date().equals(b.date())) {
            throw new IllegalArgumentException("Cells must be on the same day: " + a + ", " + b);
        }
        GridCell first = a.index() <= b.index() ? a : b;
        GridCell last = a.index() <= b.index() ? b : a;
        return new TimeInterval(startOf(first), startOf(last).plus(granule));
    }

    private Instant openingOf(LocalDate date) {
        return date.atTime(openingHour, 0).atZone(zone).toInstant();
    }
}
