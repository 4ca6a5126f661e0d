package com.keer.roombooking.booking.policy;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Set;

/**
 * Usage policy applied at admission. Operating hours are whole hours in {@link #zone}.
 */
@Data
@ConfigurationProperties(prefix = "booking.policy")
public class BookingPolicyProperties {

    private Duration leadTime = Duration.ofMinutes(30);

    private Duration minDuration = Duration.ofMinutes(15);

    private Duration maxDuration = Duration.ofHours(4);

    private int openingHour = 8;

    private int closingHour = 22;

    private ZoneId zone = ZoneId.of("UTC");

    private Set<DayOfWeek> closedDays = EnumSet.noneOf(DayOfWeek.class);
}
