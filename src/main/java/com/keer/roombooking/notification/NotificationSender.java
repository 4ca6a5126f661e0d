package com.keer.roombooking.notification;

/**
 * Outbound delivery to members. Implementations throw {@link NotificationException} when the
 * message was not accepted by the transport.
 */
public interface NotificationSender {

    void sendReminder(String recipientAddress, String recipientName, ReminderDetails details);

    void sendCancellation(String recipientAddress, String recipientName, CancellationDetails details);
}
