package com.flagship.loyalty_ledger.enrollment;

import com.flagship.loyalty_ledger.card.CardRegistry;
import com.flagship.loyalty_ledger.card.LoyaltyCard;
import com.flagship.loyalty_ledger.notification.NotificationOutbox;
import com.flagship.loyalty_ledger.notification.NotificationType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Each enrollment transition as one database transaction: the enrollment row,
 * the approval request, the card and the outbox rows commit together or not
 * at all.
 *
 * Retries, MDC and metrics live in {@link EnrollmentWorkflow}.
 */
@Component
@Slf4j
public class EnrollmentTransitions {

    static final Set<EnrollmentStatus> LIVE_STATUSES =
        EnumSet.of(EnrollmentStatus.INVITED, EnrollmentStatus.PENDING_APPROVAL, EnrollmentStatus.ACTIVE);

    static final String EXPIRED_REASON = "approval request expired";

    private final EnrollmentRepository enrollmentRepository;
    private final ApprovalRequestRepository approvalRepository;
    private final CardRegistry cardRegistry;
    private final NotificationOutbox outbox;
    private final Clock clock;
    private final Duration approvalTtl;

    public EnrollmentTransitions(EnrollmentRepository enrollmentRepository,
                                 ApprovalRequestRepository approvalRepository,
                                 CardRegistry cardRegistry,
                                 NotificationOutbox outbox,
                                 Clock clock,
                                 @Value("${loyalty.enrollment.approval-ttl:72h}") Duration approvalTtl) {
        this.enrollmentRepository = enrollmentRepository;
        this.approvalRepository = approvalRepository;
        this.cardRegistry = cardRegistry;
        this.outbox = outbox;
        this.clock = clock;
        this.approvalTtl = approvalTtl;
    }

    /**
     * Creates the enrollment and its approval request. When {@code originKey}
     * is set and an enrollment was already created under it, that invitation
     * is returned unchanged.
     */
    @Transactional
    public Invitation invite(String customerId, String programId, String businessId, String originKey) {
        if (originKey != null) {
            Optional<Invitation> existing = findInvitation(originKey);
            if (existing.isPresent()) {
                log.info("Invitation for origin {} already exists as enrollment {}",
                        originKey, existing.get().getEnrollmentId());
                return existing.get();
            }
        }
        if (enrollmentRepository.findFirstByCustomerIdAndProgramIdAndStatusIn(
                customerId, programId, LIVE_STATUSES).isPresent()) {
            throw new AlreadyEnrolledException(customerId, programId);
        }

        Instant now = clock.instant();
        Enrollment invited = Enrollment.invite(customerId, programId, businessId, originKey, now);
        EnrollmentEntity entity = EnrollmentEntity.fromDomain(invited);
        try {
            entity = enrollmentRepository.saveAndFlush(entity);
        } catch (DataIntegrityViolationException e) {
            // A concurrent invite for the same pair won the partial unique index.
            log.info("Concurrent invite for customer {} in program {} lost the race", customerId, programId);
            throw new AlreadyEnrolledException(customerId, programId);
        }

        ApprovalRequest request = ApprovalRequest.issue(invited.getId(), now, approvalTtl);
        approvalRepository.save(ApprovalRequestEntity.fromDomain(request));

        Enrollment pending = invited.awaitApproval(now);
        entity.updateFromDomain(pending);
        enrollmentRepository.saveAndFlush(entity);

        Map<String, Object> payload = payload(pending);
        payload.put("approval_request_id", request.getId());
        payload.put("expires_at", request.getExpiresAt());
        outbox.append(NotificationType.ENROLLMENT_REQUESTED, pending.getCustomerId(), pending.getId(), 0, payload);

        log.info("Invited customer {} to program {} (enrollment {}, approval request {} expires {})",
                customerId, programId, pending.getId(), request.getId(), request.getExpiresAt());

        return new Invitation(pending.getId(), request.getId(), customerId, programId, businessId,
            pending.getStatus(), request.getExpiresAt());
    }

    /**
     * Answers an approval request. The request row is locked first, so of two
     * concurrent answers exactly one succeeds and the other sees it.
     */
    @Transactional
    public EnrollmentDecision respond(UUID approvalRequestId, boolean accept) {
        ApprovalRequestEntity requestEntity = approvalRepository.findByIdForUpdate(approvalRequestId)
            .orElseThrow(() -> new ApprovalRequestNotFoundException(
                "Approval request not found: " + approvalRequestId));
        ApprovalRequest request = requestEntity.toDomain();
        Instant now = clock.instant();

        if (request.getStatus() == ApprovalStatus.EXPIRED) {
            throw new RequestExpiredException(request.getId(), request.getExpiresAt());
        }
        if (request.getStatus() != ApprovalStatus.PENDING) {
            throw new AlreadyRespondedException(request.getId(), request.getStatus());
        }
        if (request.isPastDeadline(now)) {
            throw new RequestExpiredException(request.getId(), request.getExpiresAt());
        }

        EnrollmentEntity enrollmentEntity = loadEnrollment(request.getEnrollmentId());
        Enrollment enrollment = enrollmentEntity.toDomain();
        if (enrollment.getStatus() != EnrollmentStatus.PENDING_APPROVAL) {
            throw new AlreadyRespondedException(request.getId(), enrollment.getStatus());
        }

        if (accept) {
            Enrollment active = enrollment.activate(now);
            enrollmentEntity.updateFromDomain(active);
            enrollmentRepository.saveAndFlush(enrollmentEntity);
            requestEntity.updateFromDomain(request.accept(now));
            approvalRepository.save(requestEntity);

            // Same transaction: no ACTIVE enrollment without a card, no card without ACTIVE.
            UUID cardId = cardRegistry.ensureCard(active.getId());

            Map<String, Object> payload = payload(active);
            payload.put("approval_request_id", request.getId());
            payload.put("card_id", cardId);
            appendToBoth(NotificationType.ENROLLMENT_ACCEPTED, active, payload);

            log.info("Enrollment {} accepted, card {}", active.getId(), cardId);
            return new EnrollmentDecision(active.getId(), request.getId(), active.getStatus(), cardId);
        }

        Enrollment declined = enrollment.decline(now, "declined by customer");
        enrollmentEntity.updateFromDomain(declined);
        enrollmentRepository.saveAndFlush(enrollmentEntity);
        requestEntity.updateFromDomain(request.decline(now));
        approvalRepository.save(requestEntity);

        Map<String, Object> payload = payload(declined);
        payload.put("approval_request_id", request.getId());
        appendToBoth(NotificationType.ENROLLMENT_DECLINED, declined, payload);

        log.info("Enrollment {} declined", declined.getId());
        return new EnrollmentDecision(declined.getId(), request.getId(), declined.getStatus(), null);
    }

    /**
     * Expires one approval request if it is still PENDING and past its deadline.
     *
     * @return true if this call expired it
     */
    @Transactional
    public boolean expire(UUID approvalRequestId) {
        Optional<ApprovalRequestEntity> found = approvalRepository.findByIdForUpdate(approvalRequestId);
        if (found.isEmpty()) {
            return false;
        }
        ApprovalRequestEntity requestEntity = found.get();
        ApprovalRequest request = requestEntity.toDomain();
        Instant now = clock.instant();
        if (request.getStatus() != ApprovalStatus.PENDING || !request.isPastDeadline(now)) {
            return false;
        }

        requestEntity.updateFromDomain(request.expire(now));
        approvalRepository.save(requestEntity);

        EnrollmentEntity enrollmentEntity = loadEnrollment(request.getEnrollmentId());
        Enrollment enrollment = enrollmentEntity.toDomain();
        if (enrollment.getStatus() != EnrollmentStatus.PENDING_APPROVAL) {
            log.warn("Expired approval request {} but enrollment {} was already {}",
                    request.getId(), enrollment.getId(), enrollment.getStatus());
            return true;
        }

        Enrollment declined = enrollment.decline(now, EXPIRED_REASON);
        enrollmentEntity.updateFromDomain(declined);
        enrollmentRepository.saveAndFlush(enrollmentEntity);

        Map<String, Object> payload = payload(declined);
        payload.put("approval_request_id", request.getId());
        payload.put("expired_at", request.getExpiresAt());
        appendToBoth(NotificationType.ENROLLMENT_EXPIRED, declined, payload);

        log.info("Approval request {} expired, enrollment {} declined", request.getId(), declined.getId());
        return true;
    }

    @Transactional
    public Enrollment revoke(UUID enrollmentId, String reason) {
        EnrollmentEntity entity = loadEnrollment(enrollmentId);
        Enrollment enrollment = entity.toDomain();
        if (enrollment.getStatus() != EnrollmentStatus.ACTIVE) {
            throw new InvalidEnrollmentStateException(enrollmentId, enrollment.getStatus(), "revoke");
        }

        Enrollment revoked = enrollment.revoke(clock.instant(), reason);
        entity.updateFromDomain(revoked);
        enrollmentRepository.saveAndFlush(entity);

        Optional<LoyaltyCard> card = cardRegistry.deactivate(enrollmentId);

        Map<String, Object> payload = payload(revoked);
        payload.put("card_id", card.map(LoyaltyCard::getId).orElse(null));
        appendToBoth(NotificationType.ENROLLMENT_REVOKED, revoked, payload);

        log.info("Enrollment {} revoked: {}", enrollmentId, reason);
        return revoked;
    }

    @Transactional(readOnly = true)
    public Enrollment getEnrollment(UUID enrollmentId) {
        return loadEnrollment(enrollmentId).toDomain();
    }

    /**
     * The invitation created under an origin key, as it was first issued.
     */
    @Transactional(readOnly = true)
    public Optional<Invitation> findInvitation(String originKey) {
        return enrollmentRepository.findByOriginKey(originKey).map(entity -> {
            ApprovalRequest first = approvalRepository.findFirstByEnrollmentIdOrderByRequestedAtAsc(entity.getId())
                .map(ApprovalRequestEntity::toDomain)
                .orElseThrow(() -> new IllegalStateException(
                    "Enrollment " + entity.getId() + " has no approval request"));
            return new Invitation(entity.getId(), first.getId(), entity.getCustomerId(), entity.getProgramId(),
                entity.getBusinessId(), entity.getStatus(), first.getExpiresAt());
        });
    }

    /**
     * The most recent approval request of an enrollment, whatever its status.
     */
    @Transactional(readOnly = true)
    public ApprovalRequest latestApprovalRequest(UUID enrollmentId) {
        loadEnrollment(enrollmentId);
        return approvalRepository.findFirstByEnrollmentIdOrderByRequestedAtDesc(enrollmentId)
            .map(ApprovalRequestEntity::toDomain)
            .orElseThrow(() -> new ApprovalRequestNotFoundException(
                "Enrollment " + enrollmentId + " has no approval request"));
    }

    @Transactional(readOnly = true)
    public List<UUID> findExpiredRequestIds(int limit) {
        return approvalRepository.findExpiredPendingIds(clock.instant(), PageRequest.of(0, limit));
    }

    private EnrollmentEntity loadEnrollment(UUID enrollmentId) {
        return enrollmentRepository.findById(enrollmentId)
            .orElseThrow(() -> new EnrollmentNotFoundException(enrollmentId));
    }

    private void appendToBoth(NotificationType type, Enrollment enrollment, Map<String, Object> payload) {
        outbox.append(type, enrollment.getCustomerId(), enrollment.getId(), 0, payload);
        if (!enrollment.getBusinessId().equals(enrollment.getCustomerId())) {
            outbox.append(type, enrollment.getBusinessId(), enrollment.getId(), 0, payload);
        }
    }

    private static Map<String, Object> payload(Enrollment enrollment) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("enrollment_id", enrollment.getId());
        payload.put("customer_id", enrollment.getCustomerId());
        payload.put("program_id", enrollment.getProgramId());
        payload.put("business_id", enrollment.getBusinessId());
        payload.put("status", enrollment.getStatus());
        return payload;
    }
}
