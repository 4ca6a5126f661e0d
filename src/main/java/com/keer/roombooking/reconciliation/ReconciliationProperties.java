package com.keer.roombooking.reconciliation;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "booking.reconciliation")
public class ReconciliationProperties {

    private boolean enabled = true;

    /** Delay between the end of one sweep and the start of the next. */
    private Duration interval = Duration.ofMinutes(5);

    /** Earliest start, relative to now, that is due a reminder. */
    private Duration reminderLeadMin = Duration.ofMinutes(15);

    /** Latest start, relative to now, that is due a reminder. */
    private Duration reminderLeadMax = Duration.ofMinutes(30);

    private Duration notificationTimeout = Duration.ofSeconds(10);
}
