package com.keer.roombooking;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

/**
 * 測試用 Bean：可調整的時鐘，以及記錄通知而不連線 Kafka 的 sender
 */
@TestConfiguration
public class TestConfig {

    @Bean
    @Primary
    public MutableClock testClock() {
        return new MutableClock(MutableClock.DEFAULT_NOW);
    }

    @Bean
    @Primary
    public RecordingNotificationSender recordingNotificationSender() {
        return new RecordingNotificationSender();
    }
}
