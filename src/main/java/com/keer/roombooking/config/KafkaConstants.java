package com.keer.roombooking.config;

public final class KafkaConstants {

    private KafkaConstants() {}

    public static final String TOPIC_BOOKING_REMINDERS = "booking-reminders";
    public static final String TOPIC_BOOKING_CANCELLATIONS = "booking-cancellations";
}
