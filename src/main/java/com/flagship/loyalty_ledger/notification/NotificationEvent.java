package com.flagship.loyalty_ledger.notification;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An immutable state-change notification.
 *
 * {@code subjectId} is the card or enrollment the event is about and
 * {@code sequence} orders events of one subject: for card events it is the
 * card version after the write, for enrollment events it is 0.
 * {@code dedupeKey} is unique across all events ever written; subscribers use
 * it to drop redeliveries.
 *
 * The remaining fields are outbox bookkeeping.
 */
@Value
public class NotificationEvent {
    UUID id;
    NotificationType type;
    String targetId;
    UUID subjectId;
    String dedupeKey;
    long sequence;
    String payload;            // JSON
    Instant createdAt;
    Instant dispatchedAt;      // null until the relay hands it to the dispatcher
    int retryCount;
    String lastError;
    Long outboxSequence;       // assigned by database

    public static NotificationEvent create(NotificationType type, String targetId, UUID subjectId,
                                           String dedupeKey, long sequence, String payload, Instant createdAt) {
        return new NotificationEvent(
            UUID.randomUUID(),
            type,
            targetId,
            subjectId,
            dedupeKey,
            sequence,
            payload,
            createdAt,
            null,
            0,
            null,
            null
        );
    }

    public boolean isDispatched() {
        return dispatchedAt != null;
    }

    /**
     * Key under which bursts of this event are coalesced.
     */
    public String coalescingKey() {
        return type + "|" + targetId + "|" + subjectId;
    }
}
