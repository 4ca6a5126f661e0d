package com.keer.roombooking.reconciliation;

import com.keer.roombooking.notification.NotificationException;
import com.keer.roombooking.notification.NotificationSender;
import com.keer.roombooking.notification.ReminderDetails;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one reminder send on the notification executor and waits at most
 * {@code booking.reconciliation.notification-timeout} for it.
 */
@Component
public class ReminderDispatcher {

    private final NotificationSender notificationSender;
    private final AsyncTaskExecutor notificationExecutor;
    private final Duration timeout;

    public ReminderDispatcher(NotificationSender notificationSender,
                              @Qualifier("notificationExecutor") AsyncTaskExecutor notificationExecutor,
                              ReconciliationProperties properties) {
        this.notificationSender = notificationSender;
        this.notificationExecutor = notificationExecutor;
        this.timeout = properties.getNotificationTimeout();
    }

    public void dispatch(String recipientAddress, String recipientName, ReminderDetails details) {
        Future<?> future = notificationExecutor.submit(
                () -> notificationSender.sendReminder(recipientAddress, recipientName, details));
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new NotificationException("Reminder for booking " + details.bookingId()
                    + " timed out after " + timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof NotificationException notificationException) {
                throw notificationException;
            }
            throw new NotificationException("Reminder for booking " + details.bookingId() + " failed", cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new NotificationException("Interrupted while sending reminder for booking " + details.bookingId(), e);
        }
    }
}
