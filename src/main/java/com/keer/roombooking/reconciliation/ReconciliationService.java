package com.keer.roombooking.reconciliation;

import com.keer.roombooking.booking.model.Booking;
import com.keer.roombooking.booking.model.BookingStatus;
import com.keer.roombooking.booking.repository.BookingRepository;
import com.keer.roombooking.member.model.Member;
import com.keer.roombooking.member.service.MemberDirectory;
import com.keer.roombooking.notification.NotificationException;
import com.keer.roombooking.notification.ReminderDetails;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * One reconciliation sweep: completes bookings that have ended, then sends reminders for
 * bookings starting soon. Each phase tolerates failures of the other and of single bookings.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReconciliationService {

    private final BookingRepository bookingRepository;
    private final MemberDirectory memberDirectory;
    private final ReminderDispatcher reminderDispatcher;
    private final ReconciliationProperties properties;
    private final Clock clock;

    public SweepReport sweep() {
        Instant now = clock.instant();
        int completed = completeEnded(now);

        int sent = 0;
        int failed = 0;
        for (Booking booking : reminderCandidates(now)) {
            try {
                if (remind(booking)) {
                    sent++;
                }
            } catch (NotificationException | DataAccessException | TransactionException | TaskRejectedException e) {
                failed++;
                log.warn("Reminder for booking {} not sent, will retry next sweep: {}", booking.getId(), e.getMessage());
            } catch (RuntimeException e) {
                failed++;
                log.error("Reminder for booking {} failed unexpectedly: {}", booking.getId(), e.getMessage(), e);
            }
        }

        SweepReport report = new SweepReport(completed, sent, failed);
        log.info("Reconciliation sweep at {}: completed={}, remindersSent={}, reminderFailures={}",
                now, completed, sent, failed);
        return report;
    }

    private int completeEnded(Instant now) {
        try {
            return bookingRepository.completeEndedBefore(BookingStatus.CONFIRMED, BookingStatus.COMPLETED, now);
        } catch (DataAccessException | TransactionException e) {
            log.error("Completion sweep failed: {}", e.getMessage(), e);
            return 0;
        }
    }

    private List<Booking> reminderCandidates(Instant now) {
        try {
            return bookingRepository.findReminderCandidates(BookingStatus.CONFIRMED,
                    now.plus(properties.getReminderLeadMin()),
                    now.plus(properties.getReminderLeadMax()));
        } catch (DataAccessException | TransactionException e) {
            log.error("Reminder sweep could not load candidates: {}", e.getMessage(), e);
            return List.of();
        }
    }

    private boolean remind(Booking booking) {
        Member owner = memberDirectory.find(booking.getOwnerId()).orElse(null);
        if (owner == null || owner.getEmail() == null || owner.getEmail().isBlank()) {
            log.debug("Booking {} owner has no address, skipping reminder", booking.getId());
            return false;
        }

        reminderDispatcher.dispatch(owner.getEmail(), owner.getName(), new ReminderDetails(
                booking.getId(), booking.getRoom().getName(), booking.getStartTime(), booking.getEndTime()));

        int updated = bookingRepository.markReminderSent(booking.getId(), BookingStatus.CONFIRMED);
        if (updated == 0) {
            log.debug("Booking {} changed during reminder dispatch, flag left as is", booking.getId());
        }
        return true;
    }
}
