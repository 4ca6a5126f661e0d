package com.keer.roombooking.reconciliation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.util.concurrent.ScheduledFuture;

/**
 * Drives {@link ReconciliationService#sweep()} with a fixed delay, so sweeps never overlap.
 */
@Component
@Slf4j
public class ReconciliationScheduler implements SmartLifecycle {

    private final ReconciliationService reconciliationService;
    private final TaskScheduler taskScheduler;
    private final ReconciliationProperties properties;

    private volatile ScheduledFuture<?> scheduledSweep;

    public ReconciliationScheduler(ReconciliationService reconciliationService,
                                   @Qualifier("reconciliationTaskScheduler") TaskScheduler taskScheduler,
                                   ReconciliationProperties properties) {
        this.reconciliationService = reconciliationService;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
    }

    @Override
    public synchronized void start() {
        if (!properties.isEnabled()) {
            log.info("Reconciliation disabled");
            return;
        }
        if (scheduledSweep == null) {
            scheduledSweep = taskScheduler.scheduleWithFixedDelay(this::runSafely, properties.getInterval());
            log.info("Reconciliation scheduled every {}", properties.getInterval());
        }
    }

    @Override
    public synchronized void stop() {
        if (scheduledSweep != null) {
            scheduledSweep.cancel(false);
            scheduledSweep = null;
        }
    }

    @Override
    public boolean isRunning() {
        return scheduledSweep != null;
    }

    void runSafely() {
        try {
            reconciliationService.sweep();
        } catch (RuntimeException e) {
            // an escaped exception would cancel all later runs
            log.error("Reconciliation sweep failed", e);
        }
    }
}
