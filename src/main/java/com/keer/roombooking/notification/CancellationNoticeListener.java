package com.keer.roombooking.notification;

import com.keer.roombooking.booking.event.BookingCancelledEvent;
import com.keer.roombooking.member.model.Member;
import com.keer.roombooking.member.service.MemberDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Tells the owner about a cancellation once it is committed. Best-effort: the cancellation
 * stands whether or not the notice goes out. The send happens on the notification executor,
 * never on the thread that committed the cancellation.
 */
@Component
@Slf4j
public class CancellationNoticeListener {

    private final MemberDirectory memberDirectory;
    private final NotificationSender notificationSender;
    private final TaskExecutor notificationExecutor;

    public CancellationNoticeListener(MemberDirectory memberDirectory,
                                      NotificationSender notificationSender,
                                      @Qualifier("notificationExecutor") TaskExecutor notificationExecutor) {
        this.memberDirectory = memberDirectory;
        this.notificationSender = notificationSender;
        this.notificationExecutor = notificationExecutor;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onBookingCancelled(BookingCancelledEvent event) {
        Member owner = memberDirectory.find(event.ownerId()).orElse(null);
        if (owner == null || owner.getEmail() == null || owner.getEmail().isBlank()) {
            log.debug("No address for owner of booking {}, skipping cancellation notice", event.bookingId());
            return;
        }

        CancellationDetails details = new CancellationDetails(
                event.bookingId(), event.roomName(), event.startTime(), event.reason());
        try {
            notificationExecutor.execute(() -> send(owner, details));
        } catch (TaskRejectedException e) {
            log.warn("Cancellation notice for booking {} dropped, notification executor is saturated: {}",
                    event.bookingId(), e.getMessage());
        }
    }

    private void send(Member owner, CancellationDetails details) {
        try {
            notificationSender.sendCancellation(owner.getEmail(), owner.getName(), details);
        } catch (NotificationException e) {
            log.warn("Cancellation notice for booking {} not delivered: {}", details.bookingId(), e.getMessage());
        }
    }
}
