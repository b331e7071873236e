package com.flagship.loyalty_ledger.ledger;

import com.flagship.loyalty_ledger.card.CardNotFoundException;
import com.flagship.loyalty_ledger.card.LoyaltyCard;
import com.flagship.loyalty_ledger.card.LoyaltyCardEntity;
import com.flagship.loyalty_ledger.card.LoyaltyCardRepository;
import com.flagship.loyalty_ledger.idempotency.IdempotencyGuard;
import com.flagship.loyalty_ledger.notification.NotificationOutbox;
import com.flagship.loyalty_ledger.notification.NotificationType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * One balance change as one database transaction.
 *
 * Order of operations:
 * 1. Idempotency lookup (cache, then database)
 * 2. SELECT ... FOR UPDATE on the card row
 * 3. Idempotency re-check under the lock (database only)
 * 4. Status and non-negative balance checks
 * 5. Card update (bumps version), transaction insert, outbox append
 *
 * Retries and error translation live in {@link TransactionLedger}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LedgerWriter {

    private final LoyaltyCardRepository cardRepository;
    private final PointTransactionRepository transactionRepository;
    private final IdempotencyGuard idempotencyGuard;
    private final NotificationOutbox outbox;
    private final Clock clock;

    @Transactional
    public LedgerResult write(LedgerWrite write) {
        Optional<PointTransaction> recorded = idempotencyGuard.findRecorded(write.getIdempotencyKey())
            .flatMap(transactionRepository::findById)
            .map(PointTransactionEntity::toDomain);
        if (recorded.isPresent()) {
            return replay(recorded.get(), write);
        }

        LoyaltyCardEntity entity = cardRepository.findByIdForUpdate(write.getCardId())
            .orElseThrow(() -> new CardNotFoundException(write.getCardId()));

        Optional<PointTransactionEntity> committedMeanwhile =
            transactionRepository.findByIdempotencyKey(write.getIdempotencyKey());
        if (committedMeanwhile.isPresent()) {
            return replay(committedMeanwhile.get().toDomain(), write);
        }

        LoyaltyCard card = entity.toDomain();
        if (!card.isActive()) {
            throw new CardInactiveException(card.getId());
        }
        if (card.getBalance() + write.getDelta() < 0) {
            throw new InsufficientBalanceException(card.getId(), card.getBalance(), write.getDelta());
        }

        Instant now = clock.instant();
        LoyaltyCard updated = card.applyDelta(write.getDelta(), now);
        entity.updateFromDomain(updated);
        cardRepository.saveAndFlush(entity);
        long version = entity.getVersion();

        PointTransaction transaction = PointTransaction.record(write, updated.getBalance(), version, now);
        transactionRepository.saveAndFlush(PointTransactionEntity.fromDomain(transaction));

        appendNotifications(card, updated, version, transaction);

        log.info("Applied {} points to card {} from {}: balance {} -> {}, version {}",
                write.getDelta(), card.getId(), write.getSource(), card.getBalance(), updated.getBalance(), version);

        return LedgerResult.applied(transaction);
    }

    /**
     * Reads back the result recorded for a transaction id.
     */
    @Transactional(readOnly = true)
    public LedgerResult replay(UUID transactionId) {
        return transactionRepository.findById(transactionId)
            .map(entity -> LedgerResult.replayOf(entity.toDomain()))
            .orElseThrow(() -> new TransactionNotFoundException(transactionId));
    }

    private LedgerResult replay(PointTransaction original, LedgerWrite write) {
        if (!original.getCardId().equals(write.getCardId()) || original.getDelta() != write.getDelta()) {
            log.warn("Idempotency key {} reused with different parameters: original card={} delta={}, now card={} delta={}",
                    write.getIdempotencyKey(), original.getCardId(), original.getDelta(),
                    write.getCardId(), write.getDelta());
        } else {
            log.info("Idempotency key {} already applied as transaction {}", write.getIdempotencyKey(), original.getId());
        }
        return LedgerResult.replayOf(original);
    }

    private void appendNotifications(LoyaltyCard before, LoyaltyCard after, long version, PointTransaction transaction) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("card_id", after.getId());
        payload.put("customer_id", after.getCustomerId());
        payload.put("business_id", after.getBusinessId());
        payload.put("program_id", after.getProgramId());
        payload.put("balance", after.getBalance());
        payload.put("delta", transaction.getDelta());
        payload.put("source", transaction.getSource());
        payload.put("transaction_id", transaction.getId());
        payload.put("tier", after.getTier());
        payload.put("version", version);

        List<String> targets = after.getCustomerId().equals(after.getBusinessId())
            ? List.of(after.getCustomerId())
            : List.of(after.getCustomerId(), after.getBusinessId());
        for (String target : targets) {
            outbox.append(NotificationType.BALANCE_CHANGED, target, after.getId(), version, payload);
        }

        if (before.getTier() != after.getTier()) {
            Map<String, Object> tierPayload = new LinkedHashMap<>();
            tierPayload.put("card_id", after.getId());
            tierPayload.put("previous_tier", before.getTier());
            tierPayload.put("tier", after.getTier());
            tierPayload.put("balance", after.getBalance());
            tierPayload.put("version", version);
            for (String target : targets) {
                outbox.append(NotificationType.CARD_TIER_CHANGED, target, after.getId(), version, tierPayload);
            }
        }
    }
}
