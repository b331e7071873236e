package com.flagship.loyalty_ledger.enrollment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for enrollments.
 *
 * The partial unique index uq_enrollments_live_pair allows at most one
 * non-terminal enrollment per (customer, program). origin_key is unique when set.
 */
@Entity
@Table(name = "enrollments")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EnrollmentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "customer_id", nullable = false, updatable = false, length = 64)
    private String customerId;

    @Column(name = "program_id", nullable = false, updatable = false, length = 64)
    private String programId;

    @Column(name = "business_id", nullable = false, updatable = false, length = 64)
    private String businessId;

    @Column(name = "origin_key", updatable = false)
    private String originKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private EnrollmentStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "activated_at")
    private Instant activatedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Column(name = "end_reason")
    private String endReason;

    @Version
    private Long version;

    static EnrollmentEntity fromDomain(Enrollment enrollment) {
        return new EnrollmentEntity(
            enrollment.getId(),
            enrollment.getCustomerId(),
            enrollment.getProgramId(),
            enrollment.getBusinessId(),
            enrollment.getOriginKey(),
            enrollment.getStatus(),
            enrollment.getCreatedAt(),
            enrollment.getUpdatedAt(),
            enrollment.getActivatedAt(),
            enrollment.getEndedAt(),
            enrollment.getEndReason(),
            null  // version - assigned on persist
        );
    }

    public Enrollment toDomain() {
        return new Enrollment(
            id,
            customerId,
            programId,
            businessId,
            originKey,
            status,
            createdAt,
            updatedAt,
            activatedAt,
            endedAt,
            endReason
        );
    }

    /**
     * Only status and lifecycle timestamps change after creation.
     */
    void updateFromDomain(Enrollment enrollment) {
        this.status = enrollment.getStatus();
        this.updatedAt = enrollment.getUpdatedAt();
        this.activatedAt = enrollment.getActivatedAt();
        this.endedAt = enrollment.getEndedAt();
        this.endReason = enrollment.getEndReason();
    }
}
