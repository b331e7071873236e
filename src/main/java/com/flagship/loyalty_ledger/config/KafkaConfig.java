package com.flagship.loyalty_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Kafka topic for the notification bridge.
 *
 * Only created when notifications are mirrored to Kafka. Keys are target ids,
 * so every event for one customer or business lands on the same partition.
 */
@Configuration
@ConditionalOnProperty(name = "notifications.kafka.enabled", havingValue = "true")
public class KafkaConfig {

    @Value("${notifications.kafka.topic:loyalty-notifications}")
    private String notificationsTopic;

    @Value("${notifications.kafka.partitions:3}")
    private int partitions;

    @Bean
    public NewTopic notificationsTopic() {
        return TopicBuilder.name(notificationsTopic)
                .partitions(partitions)
                .replicas(1)
                .build();
    }
}
