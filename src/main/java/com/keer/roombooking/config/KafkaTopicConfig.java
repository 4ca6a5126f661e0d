package com.keer.roombooking.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

@Configuration
public class KafkaTopicConfig {

    @Bean
    public NewTopic bookingRemindersTopic() {
        return TopicBuilder.name(KafkaConstants.TOPIC_BOOKING_REMINDERS).partitions(6).replicas(1).build();
    }

    @Bean
    public NewTopic bookingCancellationsTopic() {
        return TopicBuilder.name(KafkaConstants.TOPIC_BOOKING_CANCELLATIONS).partitions(6).replicas(1).build();
    }
}
