package com.flagship.loyalty_ledger.notification;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for the notification outbox (notification_events).
 */
@Entity
@Table(name = "notification_events")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class NotificationEventEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, updatable = false, length = 64)
    private NotificationType type;

    @Column(name = "target_id", nullable = false, updatable = false, length = 64)
    private String targetId;

    @Column(name = "subject_id", nullable = false, updatable = false)
    private UUID subjectId;

    @Column(name = "dedupe_key", nullable = false, updatable = false, unique = true)
    private String dedupeKey;

    @Column(name = "sequence", nullable = false, updatable = false)
    private long sequence;

    @Column(name = "payload", nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "dispatched_at")
    private Instant dispatchedAt;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "outbox_sequence", insertable = false, updatable = false)
    private Long outboxSequence;

    static NotificationEventEntity fromDomain(NotificationEvent event) {
        NotificationEventEntity entity = new NotificationEventEntity();
        entity.id = event.getId();
        entity.type = event.getType();
        entity.targetId = event.getTargetId();
        entity.subjectId = event.getSubjectId();
        entity.dedupeKey = event.getDedupeKey();
        entity.sequence = event.getSequence();
        entity.payload = event.getPayload();
        entity.createdAt = event.getCreatedAt();
        entity.dispatchedAt = event.getDispatchedAt();
        entity.retryCount = event.getRetryCount();
        entity.lastError = event.getLastError();
        return entity;
    }

    public NotificationEvent toDomain() {
        return new NotificationEvent(
            id,
            type,
            targetId,
            subjectId,
            dedupeKey,
            sequence,
            payload,
            createdAt,
            dispatchedAt,
            retryCount,
            lastError,
            outboxSequence
        );
    }

    void markDispatched(Instant at) {
        this.dispatchedAt = at;
        this.lastError = null;
    }

    void markFailed(String errorMessage) {
        this.retryCount++;
        this.lastError = errorMessage;
    }
}
