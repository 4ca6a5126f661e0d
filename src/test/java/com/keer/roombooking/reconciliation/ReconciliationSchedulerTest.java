package com.keer.roombooking.reconciliation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReconciliationSchedulerTest {

    @Mock
    private ReconciliationService reconciliationService;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> future;

    @Test
    void startSchedulesWithConfiguredDelayAndStopCancels() {
        ReconciliationProperties properties = new ReconciliationProperties();
        properties.setInterval(Duration.ofMinutes(1));
        ReconciliationScheduler scheduler = new ReconciliationScheduler(reconciliationService, taskScheduler, properties);
        doReturn(future).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofMinutes(1)));

        scheduler.start();
        assertTrue(scheduler.isRunning());

        scheduler.stop();
        assertFalse(scheduler.isRunning());
        verify(future).cancel(false);
    }

    @Test
    void disabledSchedulerNeverSchedules() {
        ReconciliationProperties properties = new ReconciliationProperties();
        properties.setEnabled(false);
        ReconciliationScheduler scheduler = new ReconciliationScheduler(reconciliationService, taskScheduler, properties);

        scheduler.start();

        assertFalse(scheduler.isRunning());
        verifyNoInteractions(taskScheduler);
    }

    @Test
    void failingSweepDoesNotEscape() {
        ReconciliationScheduler scheduler = new ReconciliationScheduler(reconciliationService, taskScheduler,
                new ReconciliationProperties());
        when(reconciliationService.sweep()).thenThrow(new IllegalStateException("store down"));

        assertDoesNotThrow(scheduler::runSafely);
    }
}
