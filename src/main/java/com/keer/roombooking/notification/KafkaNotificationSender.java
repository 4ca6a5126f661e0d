package com.keer.roombooking.notification;

import com.keer.roombooking.config.KafkaConstants;
import com.keer.roombooking.notification.event.CancellationMessage;
import com.keer.roombooking.notification.event.ReminderMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Hands notifications to the mail gateway through Kafka. A send counts as delivered once the
 * broker acknowledges it.
 */
@Component
@Slf4j
public class KafkaNotificationSender implements NotificationSender {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final Clock clock;
    private final Duration ackTimeout;

    public KafkaNotificationSender(KafkaTemplate<String, Object> kafkaTemplate,
                                   Clock clock,
                                   @Value("${app.notification.ack-timeout:PT5S}") Duration ackTimeout) {
        this.kafkaTemplate = kafkaTemplate;
        this.clock = clock;
        this.ackTimeout = ackTimeout;
    }

    @Override
    public void sendReminder(String recipientAddress, String recipientName, ReminderDetails details) {
        ReminderMessage message = new ReminderMessage(
                details.bookingId(),
                recipientAddress,
                recipientName,
                details.roomName(),
                details.startTime(),
                details.endTime(),
                clock.instant());
        publish(KafkaConstants.TOPIC_BOOKING_REMINDERS, details.bookingId(), message);
        log.info("Reminder queued for booking {} to {}", details.bookingId(), recipientAddress);
    }

    @Override
    public void sendCancellation(String recipientAddress, String recipientName, CancellationDetails details) {
        CancellationMessage message = new CancellationMessage(
                details.bookingId(),
                recipientAddress,
                recipientName,
                details.roomName(),
                details.startTime(),
                details.reason(),
                clock.instant());
        publish(KafkaConstants.TOPIC_BOOKING_CANCELLATIONS, details.bookingId(), message);
        log.info("Cancellation notice queued for booking {} to {}", details.bookingId(), recipientAddress);
    }

    private void publish(String topic, Long bookingId, Object message) {
        try {
            kafkaTemplate.send(topic, String.valueOf(bookingId), message)
                    .get(ackTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationException("Interrupted while publishing to " + topic, e);
        } catch (ExecutionException e) {
            throw new NotificationException("Failed to publish to " + topic + ": " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new NotificationException("No acknowledgement from " + topic + " within " + ackTimeout, e);
        } catch (RuntimeException e) {
            // KafkaTemplate.send itself throws when metadata cannot be fetched
            throw new NotificationException("Failed to publish to " + topic + ": " + e.getMessage(), e);
        }
    }
}
