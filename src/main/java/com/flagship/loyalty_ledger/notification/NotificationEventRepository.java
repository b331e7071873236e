package com.flagship.loyalty_ledger.notification;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface NotificationEventRepository extends JpaRepository<NotificationEventEntity, UUID> {

    /**
     * Undispatched events in write order. SKIP LOCKED lets several relay
     * instances drain the outbox without blocking each other. Dead-lettered
     * rows (retry_count at the limit) are left out.
     */
    @Query(value = """
        SELECT * FROM notification_events
        WHERE dispatched_at IS NULL AND retry_count < :maxRetries
        ORDER BY outbox_sequence ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<NotificationEventEntity> findUndispatchedForUpdate(@Param("maxRetries") int maxRetries,
                                                            @Param("limit") int limit);

    /**
     * Polling transport: events for one target after a cursor.
     */
    @Query(value = """
        SELECT * FROM notification_events
        WHERE target_id = :targetId AND outbox_sequence > :afterSequence
        ORDER BY outbox_sequence ASC
        LIMIT :limit
        """, nativeQuery = true)
    List<NotificationEventEntity> findForTargetAfter(@Param("targetId") String targetId,
                                                     @Param("afterSequence") long afterSequence,
                                                     @Param("limit") int limit);

    List<NotificationEventEntity> findBySubjectIdOrderByOutboxSequenceAsc(UUID subjectId);

    @Query("SELECT COUNT(e) FROM NotificationEventEntity e WHERE e.dispatchedAt IS NULL")
    long countUndispatched();

    long countByDispatchedAtIsNullAndRetryCountGreaterThanEqual(int retryCount);

    @Query("""
        SELECT MIN(e.createdAt) FROM NotificationEventEntity e
        WHERE e.dispatchedAt IS NULL
        """)
    Optional<Instant> findOldestUndispatchedCreatedAt();
}
