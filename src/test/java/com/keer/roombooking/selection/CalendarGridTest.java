package com.keer.roombooking.selection;

import com.keer.roombooking.booking.model.TimeInterval;
import com.keer.roombooking.booking.policy.BookingPolicyProperties;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CalendarGridTest {

    private static final LocalDate MONDAY = LocalDate.of(2030, 6, 3);

    private final CalendarGrid grid = CalendarGrid.from(new BookingPolicyProperties());

    @Test
    void defaultGridHasFifteenMinuteGranulesFromEightToTwentyTwo() {
        assertEquals(56, grid.granulesPerDay());
        assertEquals(Instant.parse("2030-06-03T08:00:00Z"), grid.startOf(new GridCell(MONDAY, 0)));
        assertEquals(new TimeInterval(Instant.parse("2030-06-03T21:45:00Z"), Instant.parse("2030-06-03T22:00:00Z")),
                grid.intervalOf(new GridCell(MONDAY, 55)));
        assertFalse(grid.contains(new GridCell(MONDAY, 56)));
    }

    @Test
    void spanIsOrderIndependentAndIncludesLastGranule() {
        GridCell a = new GridCell(MONDAY, 8);
        GridCell b = new GridCell(MONDAY, 4);
        TimeInterval expected = new TimeInterval(
                Instant.parse("2030-06-03T09:00:00Z"), Instant.parse("2030-06-03T10:15:00Z"));

        assertEquals(expected, grid.span(a, b));
        assertEquals(expected, grid.span(b, a));
    }

    @Test
    void spanAcrossDaysIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> grid.span(new GridCell(MONDAY, 0), new GridCell(MONDAY.plusDays(1), 0)));
    }

    @Test
    void gridFollowsZoneAndClosedDays() {
        CalendarGrid taipei = new CalendarGrid(9, 17, Duration.ofMinutes(30), ZoneId.of("Asia/Taipei"),
                EnumSet.of(DayOfWeek.SUNDAY));

        assertEquals(16, taipei.granulesPerDay());
        assertEquals(Instant.parse("2030-06-03T01:00:00Z"), taipei.startOf(new GridCell(MONDAY, 0)));
        assertTrue(taipei.isClosed(LocalDate.of(2030, 6, 2)));
        assertFalse(taipei.isClosed(MONDAY));
    }

    @Test
    void rejectsGranuleThatDoesNotDivideAnHour() {
        assertThrows(IllegalArgumentException.class,
                () -> new CalendarGrid(8, 22, Duration.ofMinutes(7), ZoneId.of("UTC"), Set.of()));
        assertThrows(IllegalArgumentException.class,
                () -> new CalendarGrid(22, 8, Duration.ofMinutes(15), ZoneId.of("UTC"), Set.of()));
    }
}
