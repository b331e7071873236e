package com.flagship.loyalty_ledger.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Subscribes a Kafka channel to every target when Kafka mirroring is enabled.
 */
@Component
@ConditionalOnProperty(name = "notifications.kafka.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class KafkaNotificationBridge {

    private final NotificationDispatcher dispatcher;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;

    @Value("${notifications.kafka.topic:loyalty-notifications}")
    private String topic;

    @Value("${notifications.kafka.send-timeout:5s}")
    private Duration sendTimeout;

    private Subscription subscription;

    @PostConstruct
    public void start() {
        subscription = dispatcher.subscribe(NotificationDispatcher.ALL_TARGETS,
                new KafkaDeliveryChannel(kafkaTemplate, objectMapper, topic, sendTimeout));
        log.info("Mirroring notifications to Kafka topic {} (send timeout {})", topic, sendTimeout);
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.cancel();
        }
    }
}
