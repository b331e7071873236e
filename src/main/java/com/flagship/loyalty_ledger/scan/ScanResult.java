package com.flagship.loyalty_ledger.scan;

import com.flagship.loyalty_ledger.enrollment.Invitation;
import com.flagship.loyalty_ledger.ledger.LedgerResult;
import lombok.Value;

import java.util.UUID;

/**
 * What a scan did. Ledger fields are set for POINTS_AWARDED, enrollment
 * fields for ENROLLMENT_REQUESTED.
 */
@Value
public class ScanResult {
    ScanOutcome outcome;
    UUID cardId;
    UUID transactionId;
    Long newBalance;
    boolean replayed;
    UUID enrollmentId;
    UUID approvalRequestId;

    static ScanResult awarded(LedgerResult result) {
        return new ScanResult(ScanOutcome.POINTS_AWARDED, result.getCardId(), result.getTransactionId(),
            result.getNewBalance(), result.isReplayed(), null, null);
    }

    static ScanResult invited(Invitation invitation, boolean replayed) {
        return new ScanResult(ScanOutcome.ENROLLMENT_REQUESTED, null, null, null, replayed,
            invitation.getEnrollmentId(), invitation.getApprovalRequestId());
    }
}
