package com.flagship.loyalty_ledger.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Transactional outbox for notification events.
 *
 * Writers (ledger, enrollment workflow) call {@link #append} inside their own
 * transaction, so an event exists if and only if the state change it describes
 * committed. Delivery happens later through {@link NotificationRelay}; writers
 * never talk to the dispatcher directly.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationOutbox {

    private final NotificationEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Appends an event within the current transaction.
     *
     * Uses MANDATORY propagation: calling this outside a transaction is a bug.
     *
     * @param type      Event type
     * @param targetId  Customer or business that should see the event
     * @param subjectId Card or enrollment the event is about
     * @param sequence  Ordering value within the subject (card version, or 0)
     * @param payload   Payload object, serialized to JSON
     * @return The stored event
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public NotificationEvent append(NotificationType type, String targetId, UUID subjectId,
                                    long sequence, Object payload) {
        String dedupeKey = dedupeKey(type, targetId, subjectId, sequence);
        NotificationEvent event = NotificationEvent.create(
            type, targetId, subjectId, dedupeKey, sequence, serializePayload(payload), clock.instant());

        NotificationEventEntity saved = repository.save(NotificationEventEntity.fromDomain(event));

        log.debug("Appended notification: type={}, target={}, subject={}, sequence={}",
                type, targetId, subjectId, sequence);

        return saved.toDomain();
    }

    /**
     * Finds undispatched events for the relay, oldest first.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<NotificationEvent> findUndispatched(int maxRetries, int limit) {
        return repository.findUndispatchedForUpdate(maxRetries, limit)
                .stream()
                .map(NotificationEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markDispatched(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markDispatched(clock.instant());
            repository.save(entity);
            log.debug("Marked notification {} as dispatched", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked notification {} as failed (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
        });
    }

    /**
     * Events for one target after a cursor, for clients that poll instead of
     * holding a subscription open.
     */
    @Transactional(readOnly = true)
    public List<NotificationEvent> findForTarget(String targetId, long afterSequence, int limit) {
        return repository.findForTargetAfter(targetId, afterSequence, limit)
                .stream()
                .map(NotificationEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<NotificationEvent> findForSubject(UUID subjectId) {
        return repository.findBySubjectIdOrderByOutboxSequenceAsc(subjectId)
                .stream()
                .map(NotificationEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUndispatched() {
        return repository.countUndispatched();
    }

    static String dedupeKey(NotificationType type, String targetId, UUID subjectId, long sequence) {
        return type + ":" + subjectId + ":" + sequence + ":" + targetId;
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize notification payload", e);
        }
    }
}
