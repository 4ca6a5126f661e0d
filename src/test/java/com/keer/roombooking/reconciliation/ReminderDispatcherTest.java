package com.keer.roombooking.reconciliation;

import com.keer.roombooking.notification.NotificationException;
import com.keer.roombooking.notification.NotificationSender;
import com.keer.roombooking.notification.ReminderDetails;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ReminderDispatcherTest {

    private static final ReminderDetails DETAILS = new ReminderDetails(1L, "研究小間A",
            Instant.parse("2030-06-03T10:00:00Z"), Instant.parse("2030-06-03T11:00:00Z"));

    private ThreadPoolTaskExecutor executor;
    private NotificationSender sender;
    private ReminderDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.initialize();
        sender = mock(NotificationSender.class);
        ReconciliationProperties properties = new ReconciliationProperties();
        properties.setNotificationTimeout(Duration.ofMillis(200));
        dispatcher = new ReminderDispatcher(sender, executor, properties);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void delegatesToSender() {
        dispatcher.dispatch("a@example.com", "小明", DETAILS);

        verify(sender).sendReminder("a@example.com", "小明", DETAILS);
    }

    @Test
    void senderFailureSurfacesAsNotificationException() {
        doThrow(new NotificationException("rejected")).when(sender).sendReminder(any(), any(), any());

        NotificationException e = assertThrows(NotificationException.class,
                () -> dispatcher.dispatch("a@example.com", "小明", DETAILS));

        assertEquals("rejected", e.getMessage());
    }

    @Test
    void unexpectedSenderErrorIsWrapped() {
        doThrow(new IllegalStateException("boom")).when(sender).sendReminder(any(), any(), any());

        NotificationException e = assertThrows(NotificationException.class,
                () -> dispatcher.dispatch("a@example.com", "小明", DETAILS));

        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void slowSenderTimesOutAndIsInterrupted() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        doAnswer(inv -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return null;
        }).when(sender).sendReminder(any(), any(), any());

        assertThrows(NotificationException.class, () -> dispatcher.dispatch("a@example.com", "小明", DETAILS));
        assertTrue(interrupted.await(2, TimeUnit.SECONDS), "timed out send should be cancelled");
    }
}
