package com.flagship.loyalty_ledger.enrollment;

import com.flagship.loyalty_ledger.observability.CorrelationContext;
import com.flagship.loyalty_ledger.observability.LedgerMetrics;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * State machine for program enrollment.
 *
 * <pre>
 * INVITED -> PENDING_APPROVAL -> ACTIVE -> REVOKED
 *                             \-> DECLINED (customer declined, or the request expired)
 * </pre>
 *
 * Enrollment status lives only on the enrollment row and is changed only
 * here. Accepting issues the loyalty card in the same transaction as the
 * status change. Every transition appends its notification to the outbox.
 *
 * Row lock and version conflicts are retried with bounded jittered backoff.
 */
@Service
@Slf4j
public class EnrollmentWorkflow {

    static final int MAX_ID_LENGTH = 64;
    static final int MAX_REASON_LENGTH = 500;
    static final int MAX_ORIGIN_KEY_LENGTH = 255;

    private final EnrollmentTransitions transitions;
    private final LedgerMetrics metrics;
    private final Retry retry;

    public EnrollmentWorkflow(EnrollmentTransitions transitions,
                              LedgerMetrics metrics,
                              @Qualifier("enrollmentRetry") Retry retry) {
        this.transitions = transitions;
        this.metrics = metrics;
        this.retry = retry;
        retry.getEventPublisher().onRetry(event -> metrics.recordLockRetry("enrollment"));
    }

    /**
     * Invites a customer into a program and opens an approval request.
     *
     * @throws AlreadyEnrolledException if the pair already has a live enrollment
     */
    public Invitation invite(String customerId, String programId, String businessId) {
        return invite(customerId, programId, businessId, null);
    }

    /**
     * Invites under an origin key. Calling again with the same key returns
     * the first invitation instead of failing with AlreadyEnrolled.
     *
     * @param originKey Key of the originating request, or null
     */
    public Invitation invite(String customerId, String programId, String businessId, String originKey) {
        requireId(customerId, "Customer id");
        requireId(programId, "Program id");
        requireId(businessId, "Business id");
        if (originKey != null && (originKey.isBlank() || originKey.length() > MAX_ORIGIN_KEY_LENGTH)) {
            throw new InvalidEnrollmentRequestException(
                "Origin key must be non-blank and at most " + MAX_ORIGIN_KEY_LENGTH + " characters");
        }

        Invitation invitation = withRetry("Enrollment of " + customerId + " in " + programId,
            () -> transitions.invite(customerId, programId, businessId, originKey));
        metrics.recordEnrollmentTransition(invitation.getStatus().name());
        return invitation;
    }

    /**
     * Accepts or declines an approval request.
     *
     * @throws ApprovalRequestNotFoundException if the request does not exist
     * @throws RequestExpiredException          if the request is past its TTL
     * @throws AlreadyRespondedException        if it was already answered
     */
    public EnrollmentDecision respond(UUID approvalRequestId, boolean accept) {
        if (approvalRequestId == null) {
            throw new InvalidEnrollmentRequestException("Approval request id is required");
        }
        EnrollmentDecision decision = withRetry("Approval request " + approvalRequestId,
            () -> transitions.respond(approvalRequestId, accept));
        try (MDC.MDCCloseable ignored = CorrelationContext.forEnrollment(decision.getEnrollmentId())) {
            log.info("Approval request {} answered: {}", approvalRequestId, decision.getStatus());
            metrics.recordEnrollmentTransition(decision.getStatus().name());
            return decision;
        }
    }

    /**
     * Answers the most recent approval request of an enrollment.
     */
    public EnrollmentDecision respondToEnrollment(UUID enrollmentId, boolean accept) {
        if (enrollmentId == null) {
            throw new InvalidEnrollmentRequestException("Enrollment id is required");
        }
        ApprovalRequest request = transitions.latestApprovalRequest(enrollmentId);
        return respond(request.getId(), accept);
    }

    /**
     * Expires a stale approval request. Called by {@link ApprovalExpirySweeper}.
     *
     * @return false if the request was already answered, expired, or not yet due
     */
    public boolean expire(UUID approvalRequestId) {
        boolean expired = withRetry("Approval request " + approvalRequestId,
            () -> transitions.expire(approvalRequestId));
        if (expired) {
            metrics.recordEnrollmentTransition("EXPIRED");
        }
        return expired;
    }

    /**
     * ACTIVE -> REVOKED. The card is deactivated, never deleted.
     *
     * @throws InvalidEnrollmentStateException if the enrollment is not ACTIVE
     */
    public Enrollment revoke(UUID enrollmentId, String reason) {
        if (enrollmentId == null) {
            throw new InvalidEnrollmentRequestException("Enrollment id is required");
        }
        String cleanReason = reason == null || reason.isBlank() ? "revoked" : reason.trim();
        if (cleanReason.length() > MAX_REASON_LENGTH) {
            throw new InvalidEnrollmentRequestException("Reason exceeds " + MAX_REASON_LENGTH + " characters");
        }

        try (MDC.MDCCloseable ignored = CorrelationContext.forEnrollment(enrollmentId)) {
            Enrollment revoked = withRetry("Enrollment " + enrollmentId,
                () -> transitions.revoke(enrollmentId, cleanReason));
            metrics.recordEnrollmentTransition(revoked.getStatus().name());
            return revoked;
        }
    }

    public Enrollment getEnrollment(UUID enrollmentId) {
        return transitions.getEnrollment(enrollmentId);
    }

    public Optional<Invitation> findInvitation(String originKey) {
        return transitions.findInvitation(originKey);
    }

    public ApprovalRequest getLatestApprovalRequest(UUID enrollmentId) {
        return transitions.latestApprovalRequest(enrollmentId);
    }

    List<UUID> findExpiredRequestIds(int limit) {
        return transitions.findExpiredRequestIds(limit);
    }

    private <T> T withRetry(String subject, Supplier<T> transition) {
        try {
            return Retry.decorateSupplier(retry, transition).get();
        } catch (ConcurrencyFailureException e) {
            log.warn("Giving up on {} after lock contention: {}", subject, e.getMessage());
            throw new ConcurrentEnrollmentModificationException(subject, e);
        }
    }

    private static void requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new InvalidEnrollmentRequestException(name + " is required");
        }
        if (value.length() > MAX_ID_LENGTH) {
            throw new InvalidEnrollmentRequestException(name + " exceeds " + MAX_ID_LENGTH + " characters");
        }
    }
}
