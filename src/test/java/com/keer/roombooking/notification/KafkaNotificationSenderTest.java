package com.keer.roombooking.notification;

import com.keer.roombooking.config.KafkaConstants;
import com.keer.roombooking.notification.event.CancellationMessage;
import com.keer.roombooking.notification.event.ReminderMessage;
import org.apache.kafka.common.errors.TimeoutException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KafkaNotificationSenderTest {

    private static final Instant NOW = Instant.parse("2030-06-03T09:00:00Z");

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private KafkaNotificationSender sender;

    @BeforeEach
    void setUp() {
        sender = new KafkaNotificationSender(kafkaTemplate, Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofMillis(200));
    }

    @SuppressWarnings("unchecked")
    private static CompletableFuture<SendResult<String, Object>> acknowledged() {
        return CompletableFuture.completedFuture((SendResult<String, Object>) mock(SendResult.class));
    }

    @Test
    void reminderIsPublishedKeyedByBooking() {
        when(kafkaTemplate.send(anyString(), anyString(), any()))
                .thenReturn(acknowledged());

        sender.sendReminder("a@example.com", "小明", new ReminderDetails(5L, "研究小間A",
                Instant.parse("2030-06-03T09:20:00Z"), Instant.parse("2030-06-03T10:00:00Z")));

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq(KafkaConstants.TOPIC_BOOKING_REMINDERS), eq("5"), captor.capture());
        ReminderMessage message = (ReminderMessage) captor.getValue();
        assertEquals("a@example.com", message.getRecipientAddress());
        assertEquals("研究小間A", message.getRoomName());
        assertEquals(NOW, message.getTimestamp());
    }

    @Test
    void cancellationCarriesReason() {
        when(kafkaTemplate.send(anyString(), anyString(), any()))
                .thenReturn(acknowledged());

        sender.sendCancellation("a@example.com", "小明", new CancellationDetails(5L, "研究小間A",
                Instant.parse("2030-06-03T10:00:00Z"), "場地維修"));

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq(KafkaConstants.TOPIC_BOOKING_CANCELLATIONS), eq("5"), captor.capture());
        assertEquals("場地維修", ((CancellationMessage) captor.getValue()).getReason());
    }

    @Test
    void brokerFailureBecomesNotificationException() {
        when(kafkaTemplate.send(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new TimeoutException("metadata")));

        assertThrows(NotificationException.class, () -> sender.sendReminder("a@example.com", "小明",
                new ReminderDetails(5L, "研究小間A", NOW, NOW.plusSeconds(3600))));
    }

    @Test
    void missingAcknowledgementTimesOut() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());

        NotificationException e = assertThrows(NotificationException.class, () -> sender.sendReminder(
                "a@example.com", "小明", new ReminderDetails(5L, "研究小間A", NOW, NOW.plusSeconds(3600))));

        assertInstanceOf(java.util.concurrent.TimeoutException.class, e.getCause());
    }
}
