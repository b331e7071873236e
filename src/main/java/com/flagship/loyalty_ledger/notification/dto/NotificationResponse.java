package com.flagship.loyalty_ledger.notification.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.flagship.loyalty_ledger.notification.NotificationEvent;
import com.flagship.loyalty_ledger.notification.NotificationType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Wire form of a notification, shared by the SSE, Kafka and polling transports.
 */
@Value
@Builder
public class NotificationResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("type")
    NotificationType type;

    @JsonProperty("target_id")
    String targetId;

    @JsonProperty("subject_id")
    UUID subjectId;

    @JsonProperty("dedupe_key")
    String dedupeKey;

    @JsonProperty("sequence")
    long sequence;

    @JsonProperty("cursor")
    Long cursor;

    @JsonProperty("payload")
    @JsonRawValue
    String payload;

    @JsonProperty("created_at")
    Instant createdAt;

    public static NotificationResponse from(NotificationEvent event) {
        return NotificationResponse.builder()
            .id(event.getId())
            .type(event.getType())
            .targetId(event.getTargetId())
            .subjectId(event.getSubjectId())
            .dedupeKey(event.getDedupeKey())
            .sequence(event.getSequence())
            .cursor(event.getOutboxSequence())
            .payload(event.getPayload())
            .createdAt(event.getCreatedAt())
            .build();
    }
}
