package com.flagship.loyalty_ledger.ledger;

import com.flagship.loyalty_ledger.card.CardRegistry;
import com.flagship.loyalty_ledger.card.LoyaltyCard;
import com.flagship.loyalty_ledger.exception.LoyaltyException;
import com.flagship.loyalty_ledger.idempotency.IdempotencyGuard;
import com.flagship.loyalty_ledger.observability.CorrelationContext;
import com.flagship.loyalty_ledger.observability.LedgerMetrics;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The single authoritative writer of point balances.
 *
 * Every balance change goes through {@link #applyDelta} or {@link #reverse}.
 * A given idempotency key is applied at most once no matter how many times or
 * how concurrently it is submitted; repeats return the original result with
 * {@code replayed = true}.
 *
 * Lock contention is retried with bounded jittered backoff. Business
 * rejections (validation, inactive card, insufficient balance) are not.
 */
@Service
@Slf4j
public class TransactionLedger {

    static final int MAX_IDEMPOTENCY_KEY_LENGTH = 255;
    static final int MAX_DESCRIPTION_LENGTH = 500;
    static final String REVERSAL_KEY_PREFIX = "reversal:";

    private final LedgerWriter writer;
    private final IdempotencyGuard idempotencyGuard;
    private final PointTransactionRepository transactionRepository;
    private final CardRegistry cardRegistry;
    private final JdbcTemplate jdbcTemplate;
    private final LedgerMetrics metrics;
    private final Retry retry;
    private final long maxPointsPerTransaction;

    public TransactionLedger(LedgerWriter writer,
                             IdempotencyGuard idempotencyGuard,
                             PointTransactionRepository transactionRepository,
                             CardRegistry cardRegistry,
                             JdbcTemplate jdbcTemplate,
                             LedgerMetrics metrics,
                             @Qualifier("ledgerRetry") Retry retry,
                             @Value("${loyalty.ledger.max-points-per-transaction:10000}") long maxPointsPerTransaction) {
        this.writer = writer;
        this.idempotencyGuard = idempotencyGuard;
        this.transactionRepository = transactionRepository;
        this.cardRegistry = cardRegistry;
        this.jdbcTemplate = jdbcTemplate;
        this.metrics = metrics;
        this.retry = retry;
        this.maxPointsPerTransaction = maxPointsPerTransaction;
        retry.getEventPublisher().onRetry(event -> metrics.recordLockRetry("apply_delta"));
    }

    public LedgerResult applyDelta(UUID cardId, long delta, TransactionSource source, String idempotencyKey) {
        return applyDelta(cardId, delta, source, idempotencyKey, null);
    }

    /**
     * Applies a signed point change to a card exactly once per idempotency key.
     *
     * @param cardId         Card to change
     * @param delta          Non-zero change; sign must match the source
     * @param source         Origin of the change; REVERSAL is not accepted here
     * @param idempotencyKey Caller-chosen key identifying this logical operation
     * @param description    Optional free text kept with the transaction
     * @return New balance and transaction id, or the recorded ones on replay
     * @throws InvalidLedgerRequestException      on malformed input
     * @throws com.flagship.loyalty_ledger.card.CardNotFoundException if the card does not exist
     * @throws CardInactiveException              if the card is deactivated
     * @throws InsufficientBalanceException       if the balance would go negative
     * @throws ConcurrentCardModificationException if lock contention outlasts the retries
     */
    public LedgerResult applyDelta(UUID cardId, long delta, TransactionSource source,
                                   String idempotencyKey, String description) {
        validate(cardId, delta, source, idempotencyKey, description);
        if (!source.isCallerSelectable()) {
            throw reject(source, new InvalidLedgerRequestException(
                "Source " + source + " is reserved for reversals"));
        }
        return execute(new LedgerWrite(cardId, delta, source, idempotencyKey, description, null));
    }

    /**
     * Appends an offsetting transaction for an earlier one.
     *
     * The key is derived from the original transaction id, so a transaction can
     * be reversed at most once and repeated calls replay the first reversal.
     */
    public LedgerResult reverse(UUID transactionId, String reason) {
        if (transactionId == null) {
            throw new InvalidLedgerRequestException("Transaction id is required");
        }
        PointTransaction original = getTransaction(transactionId);
        if (original.isReversal()) {
            throw reject(TransactionSource.REVERSAL,
                new InvalidLedgerRequestException("Transaction " + transactionId + " is itself a reversal"));
        }
        String description = reason != null && !reason.isBlank()
            ? truncate(reason)
            : "Reversal of " + transactionId;
        return execute(new LedgerWrite(original.getCardId(), -original.getDelta(), TransactionSource.REVERSAL,
            REVERSAL_KEY_PREFIX + transactionId, description, transactionId));
    }

    /**
     * The result already recorded for an idempotency key, if any.
     */
    public Optional<LedgerResult> findApplied(String idempotencyKey) {
        return idempotencyGuard.findRecorded(idempotencyKey).map(writer::replay);
    }

    @Transactional(readOnly = true)
    public PointTransaction getTransaction(UUID transactionId) {
        return transactionRepository.findById(transactionId)
            .map(PointTransactionEntity::toDomain)
            .orElseThrow(() -> new TransactionNotFoundException(transactionId));
    }

    /**
     * Most recent transactions first.
     */
    @Transactional(readOnly = true)
    public List<PointTransaction> getHistory(UUID cardId, int limit) {
        if (limit < 1 || limit > 500) {
            throw new InvalidLedgerRequestException("limit must be between 1 and 500");
        }
        cardRegistry.getCard(cardId);
        return transactionRepository.findByCardIdOrderBySequenceNumberDesc(cardId, PageRequest.of(0, limit))
            .stream()
            .map(PointTransactionEntity::toDomain)
            .toList();
    }

    /**
     * Stored balance plus totals aggregated from the log.
     */
    @Transactional(readOnly = true)
    public LedgerSummary summarize(UUID cardId) {
        LoyaltyCard card = cardRegistry.getCard(cardId);
        return jdbcTemplate.queryForObject("""
            SELECT COALESCE(SUM(CASE WHEN delta > 0 THEN delta ELSE 0 END), 0) AS earned,
                   COALESCE(SUM(CASE WHEN delta < 0 AND source = 'REDEMPTION' THEN -delta ELSE 0 END), 0) AS redeemed,
                   COALESCE(SUM(CASE WHEN delta < 0 AND source <> 'REDEMPTION' THEN -delta ELSE 0 END), 0) AS deducted,
                   COUNT(*) AS transaction_count
            FROM point_transactions
            WHERE card_id = ?
            """,
            (rs, rowNum) -> new LedgerSummary(
                cardId,
                card.getBalance(),
                rs.getLong("earned"),
                rs.getLong("redeemed"),
                rs.getLong("deducted"),
                rs.getLong("transaction_count")),
            cardId);
    }

    /**
     * Verifies that the stored balance equals the sum of the card's deltas.
     *
     * @return true if consistent; a mismatch is logged at ERROR
     */
    @Transactional(readOnly = true)
    public boolean reconcile(UUID cardId) {
        LedgerSummary summary = summarize(cardId);
        if (!summary.isConsistent()) {
            log.error("Ledger mismatch for card {}: stored balance {}, log total {}",
                    cardId, summary.getBalance(),
                    summary.getTotalEarned() - summary.getTotalRedeemed() - summary.getTotalDeducted());
            return false;
        }
        return true;
    }

    private LedgerResult execute(LedgerWrite write) {
        long start = System.nanoTime();
        try (MDC.MDCCloseable ignored = CorrelationContext.forCard(write.getCardId())) {
            LedgerResult result = Retry.decorateSupplier(retry, () -> writeOnce(write)).get();

            if (result.isReplayed()) {
                metrics.recordIdempotencyHit();
            } else {
                metrics.recordIdempotencyMiss();
                metrics.recordDeltaApplied(write.getSource().name(), write.getDelta());
            }
            idempotencyGuard.remember(write.getIdempotencyKey(), result.getTransactionId());
            return result;

        } catch (ConcurrencyFailureException e) {
            log.warn("Giving up on card {} after lock contention: {}", write.getCardId(), e.getMessage());
            throw reject(write.getSource(), new ConcurrentCardModificationException(write.getCardId(), e));
        } catch (LoyaltyException e) {
            throw reject(write.getSource(), e);
        } finally {
            metrics.recordLatency(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private LedgerResult writeOnce(LedgerWrite write) {
        try {
            return writer.write(write);
        } catch (DataIntegrityViolationException e) {
            // Same key committed by a concurrent request between our check and insert.
            return idempotencyGuard.findRecordedInDatabase(write.getIdempotencyKey())
                .map(writer::replay)
                .orElseThrow(() -> e);
        }
    }

    private void validate(UUID cardId, long delta, TransactionSource source, String idempotencyKey, String description) {
        String sourceTag = source != null ? source.name() : null;
        if (cardId == null) {
            throw reject(sourceTag, "Card id is required");
        }
        if (source == null) {
            throw reject(sourceTag, "Source is required");
        }
        if (delta == 0) {
            throw reject(sourceTag, "Delta must be non-zero");
        }
        if (Math.abs(delta) > maxPointsPerTransaction) {
            throw reject(sourceTag, "Delta " + delta + " exceeds the limit of "
                + maxPointsPerTransaction + " points per transaction");
        }
        if (!source.permits(delta)) {
            throw reject(sourceTag, "Delta " + delta + " has the wrong sign for source " + source);
        }
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw reject(sourceTag, "Idempotency key is required");
        }
        if (idempotencyKey.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
            throw reject(sourceTag, "Idempotency key exceeds " + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
        }
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw reject(sourceTag, "Description exceeds " + MAX_DESCRIPTION_LENGTH + " characters");
        }
    }

    private InvalidLedgerRequestException reject(String source, String message) {
        InvalidLedgerRequestException e = new InvalidLedgerRequestException(message);
        metrics.recordDeltaRejected(source, e.getCode());
        return e;
    }

    private LoyaltyException reject(TransactionSource source, LoyaltyException e) {
        metrics.recordDeltaRejected(source.name(), e.getCode());
        return e;
    }

    private static String truncate(String value) {
        return value.length() > MAX_DESCRIPTION_LENGTH ? value.substring(0, MAX_DESCRIPTION_LENGTH) : value;
    }
}
