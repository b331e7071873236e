package com.flagship.loyalty_ledger.notification;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.loyalty_ledger.notification.dto.NotificationResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Mirrors notifications onto a Kafka topic for downstream consumers.
 *
 * The target id is the record key, so per-target order is preserved within
 * a partition. Sends are synchronous so a broker failure surfaces as a
 * delivery failure in the dispatcher. A send that is not acknowledged within
 * the send timeout fails with a {@link java.util.concurrent.TimeoutException}
 * instead of holding the relay thread.
 */
@Slf4j
public class KafkaDeliveryChannel implements DeliveryChannel {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;
    private final Duration sendTimeout;

    public KafkaDeliveryChannel(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper,
                                String topic, Duration sendTimeout) {
        if (sendTimeout == null || sendTimeout.isNegative() || sendTimeout.isZero()) {
            throw new IllegalArgumentException("Kafka send timeout must be positive");
        }
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topic = topic;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public void deliver(NotificationEvent event) throws Exception {
        String value = objectMapper.writeValueAsString(NotificationResponse.from(event));
        SendResult<String, String> result = kafkaTemplate.send(topic, event.getTargetId(), value)
                .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);

        log.debug("Published notification: dedupeKey={}, topic={}, partition={}, offset={}",
                event.getDedupeKey(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset());
    }

    @Override
    public boolean isOpen() {
        return true;
    }

    @Override
    public String name() {
        return "kafka";
    }
}
