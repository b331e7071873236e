package com.flagship.loyalty_ledger.enrollment;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ApprovalRequestRepository extends JpaRepository<ApprovalRequestEntity, UUID> {

    /**
     * Locks the request row. Concurrent responses to one request serialize
     * here, and the loser sees the winner's outcome.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM ApprovalRequestEntity a WHERE a.id = :id")
    Optional<ApprovalRequestEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<ApprovalRequestEntity> findFirstByEnrollmentIdOrderByRequestedAtDesc(UUID enrollmentId);

    Optional<ApprovalRequestEntity> findFirstByEnrollmentIdOrderByRequestedAtAsc(UUID enrollmentId);

    @Query("""
        SELECT a.id FROM ApprovalRequestEntity a
        WHERE a.status = com.flagship.loyalty_ledger.enrollment.ApprovalStatus.PENDING
          AND a.expiresAt <= :now
        ORDER BY a.expiresAt ASC
        """)
    List<UUID> findExpiredPendingIds(@Param("now") Instant now, Pageable pageable);

    long countByStatusAndExpiresAtLessThanEqual(ApprovalStatus status, Instant deadline);
}
