package com.keer.roombooking.booking.service;

import com.keer.roombooking.booking.policy.BookingPolicyProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZonedDateTime;

/**
 * Stateless admission rules 1-3: lead time, duration bounds and operating hours.
 * The overlap rule needs the store and lives in {@link AdmissionService}.
 */
@Component
@RequiredArgsConstructor
public class AdmissionPolicy {

    private final BookingPolicyProperties policy;
    private final Clock clock;

    /**
     * Checks the rules in order and throws on the first one that fails.
     */
    public void validate(Instant start, Instant end) {
        checkLeadTime(start);
        checkDuration(start, end);
        checkOperatingHours(start, end);
    }

    void checkLeadTime(Instant start) {
        Instant earliest = clock.instant().plus(policy.getLeadTime());
        if (start.isBefore(earliest)) {
            throw new BookingException(BookingError.LEAD_TIME_VIOLATION,
                    "Bookings must start at least " + policy.getLeadTime().toMinutes()
                            + " minutes from now (earliest " + earliest + ")");
        }
    }

    void checkDuration(Instant start, Instant end) {
        Duration duration = Duration.between(start, end);
        if (duration.compareTo(policy.getMinDuration()) < 0 || duration.compareTo(policy.getMaxDuration()) > 0) {
            throw new BookingException(BookingError.DURATION_VIOLATION,
                    "Booking duration must be between " + policy.getMinDuration().toMinutes()
                            + " and " + policy.getMaxDuration().toMinutes() + " minutes, was "
                            + duration.toMinutes());
        }
    }

    void checkOperatingHours(Instant start, Instant end) {
        ZonedDateTime localStart = start.atZone(policy.getZone());
        ZonedDateTime localEnd = end.atZone(policy.getZone());
        LocalTime opening = LocalTime.of(policy.getOpeningHour(), 0);
        LocalTime closing = LocalTime.of(policy.getClosingHour(), 0);

        if (!localStart.toLocalDate().equals(localEnd.toLocalDate())) {
            throw outsideHours("Booking may not cross midnight");
        }
        if (policy.getClosedDays().contains(localStart.getDayOfWeek())) {
            throw outsideHours("Rooms are closed on " + localStart.getDayOfWeek());
        }
        if (localStart.toLocalTime().isBefore(opening) || localEnd.toLocalTime().isAfter(closing)) {
            throw outsideHours("Booking must fall within operating hours " + opening + "-" + closing);
        }
    }

    private BookingException outsideHours(String message) {
        return new BookingException(BookingError.OUTSIDE_OPERATING_HOURS, message);
    }
}
