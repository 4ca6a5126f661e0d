package com.keer.roombooking;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * UTC clock whose instant is set by the test.
 */
public class MutableClock extends Clock {

    // Monday
    public static final Instant DEFAULT_NOW = Instant.parse("2030-06-03T09:00:00Z");

    private volatile Instant now;

    public MutableClock(Instant now) {
        this.now = now;
    }

    public void setInstant(Instant now) {
        this.now = now;
    }

    public void advance(Duration duration) {
        this.now = now.plus(duration);
    }

    public void reset() {
        this.now = DEFAULT_NOW;
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return Clock.fixed(now, zone);
    }

    @Override
    public Instant instant() {
        return now;
    }
}
