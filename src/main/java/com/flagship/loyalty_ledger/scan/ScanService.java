package com.flagship.loyalty_ledger.scan;

import com.flagship.loyalty_ledger.card.CardRegistry;
import com.flagship.loyalty_ledger.card.LoyaltyCard;
import com.flagship.loyalty_ledger.enrollment.EnrollmentWorkflow;
import com.flagship.loyalty_ledger.enrollment.Invitation;
import com.flagship.loyalty_ledger.ledger.LedgerResult;
import com.flagship.loyalty_ledger.ledger.TransactionLedger;
import com.flagship.loyalty_ledger.ledger.TransactionSource;
import com.flagship.loyalty_ledger.qr.QrCodeValidator;
import com.flagship.loyalty_ledger.qr.QrPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for QR scans at a business.
 *
 * Flow:
 * 1. A scan id already seen returns the recorded result, whether it awarded
 *    points or invited the customer (network retries)
 * 2. The QR payload is validated for the scanning business
 * 3. A card code awards points to that card
 * 4. A customer code awards points to the customer's active card in the
 *    program, or invites the customer when there is none
 *
 * Point amounts come from the caller; this service does not compute them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScanService {

    static final String SCAN_KEY_PREFIX = "scan:";
    static final int MAX_SCAN_ID_LENGTH = 200;

    private final QrCodeValidator validator;
    private final TransactionLedger ledger;
    private final CardRegistry cardRegistry;
    private final EnrollmentWorkflow enrollmentWorkflow;

    public ScanResult scan(String rawPayload, String businessId, String programId, long points, String scanId) {
        if (scanId == null || scanId.isBlank()) {
            throw new InvalidScanRequestException("Scan id is required");
        }
        if (scanId.length() > MAX_SCAN_ID_LENGTH) {
            throw new InvalidScanRequestException("Scan id exceeds " + MAX_SCAN_ID_LENGTH + " characters");
        }
        if (businessId == null || businessId.isBlank()) {
            throw new InvalidScanRequestException("Business id is required");
        }
        if (points <= 0) {
            throw new InvalidScanRequestException("Points must be positive");
        }

        String idempotencyKey = SCAN_KEY_PREFIX + scanId;
        Optional<LedgerResult> applied = ledger.findApplied(idempotencyKey);
        if (applied.isPresent()) {
            log.info("Scan {} already applied as transaction {}", scanId, applied.get().getTransactionId());
            return ScanResult.awarded(applied.get());
        }
        Optional<Invitation> invited = enrollmentWorkflow.findInvitation(idempotencyKey);
        if (invited.isPresent()) {
            log.info("Scan {} already invited customer {} (enrollment {})",
                    scanId, invited.get().getCustomerId(), invited.get().getEnrollmentId());
            return ScanResult.invited(invited.get(), true);
        }

        QrPayload payload = validator.validate(rawPayload, businessId);

        return switch (payload.getType()) {
            case LOYALTY_CARD -> scanCard(payload, businessId, programId, points, idempotencyKey, scanId);
            case CUSTOMER -> scanCustomer(payload, businessId, programId, points, idempotencyKey, scanId);
        };
    }

    private ScanResult scanCard(QrPayload payload, String businessId, String programId,
                                long points, String idempotencyKey, String scanId) {
        UUID cardId;
        try {
            cardId = UUID.fromString(payload.getSubjectId());
        } catch (IllegalArgumentException e) {
            throw new InvalidScanRequestException("QR subject is not a card id");
        }
        LoyaltyCard card = cardRegistry.getCard(cardId);
        if (!card.getBusinessId().equals(businessId)) {
            throw new InvalidScanRequestException("Card " + cardId + " does not belong to business " + businessId);
        }
        if (programId != null && !programId.isBlank() && !card.getProgramId().equals(programId)) {
            throw new InvalidScanRequestException("Card " + cardId + " does not belong to program " + programId);
        }
        return award(card, points, idempotencyKey, scanId);
    }

    private ScanResult scanCustomer(QrPayload payload, String businessId, String programId,
                                    long points, String idempotencyKey, String scanId) {
        if (programId == null || programId.isBlank()) {
            throw new InvalidScanRequestException("Program id is required for customer codes");
        }
        String customerId = payload.getSubjectId();
        Optional<LoyaltyCard> card = cardRegistry.findActiveCard(customerId, programId);
        if (card.isPresent()) {
            return award(card.get(), points, idempotencyKey, scanId);
        }

        Invitation invitation = enrollmentWorkflow.invite(customerId, programId, businessId, idempotencyKey);
        log.info("Scan {}: customer {} has no card in program {}, invited (enrollment {})",
                scanId, customerId, programId, invitation.getEnrollmentId());
        return ScanResult.invited(invitation, false);
    }

    private ScanResult award(LoyaltyCard card, long points, String idempotencyKey, String scanId) {
        LedgerResult result = ledger.applyDelta(card.getId(), points, TransactionSource.QR_SCAN,
            idempotencyKey, "QR scan " + scanId);
        return ScanResult.awarded(result);
    }
}
