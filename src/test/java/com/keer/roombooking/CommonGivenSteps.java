package com.keer.roombooking;

import io.cucumber.java.zh_tw.假如;
import io.cucumber.java.zh_tw.當;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;

/**
 * 跨模組共用的時間控制步驟
 */
public class CommonGivenSteps {

    @Autowired
    private MutableClock clock;

    @假如("^現在時間為「(.+)」$")
    public void 現在時間為(String instant) {
        clock.setInstant(Instant.parse(instant));
    }

    @當("^時間前進 (\\d+) 分鐘$")
    public void 時間前進N分鐘(int minutes) {
        clock.advance(Duration.ofMinutes(minutes));
    }
}
