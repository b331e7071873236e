package com.flagship.loyalty_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One immutable entry in a card's point history.
 *
 * {@code balanceAfter} and {@code cardVersion} capture the card state this
 * entry produced; they are what an idempotent replay returns.
 */
@Value
public class PointTransaction {
    UUID id;
    UUID cardId;
    long delta;
    TransactionSource source;
    String idempotencyKey;
    long balanceAfter;
    long cardVersion;
    String description;
    UUID reversesTransactionId;
    Instant createdAt;
    Long sequenceNumber;       // assigned by database

    public static PointTransaction record(LedgerWrite write, long balanceAfter, long cardVersion, Instant at) {
        return new PointTransaction(
            UUID.randomUUID(),
            write.getCardId(),
            write.getDelta(),
            write.getSource(),
            write.getIdempotencyKey(),
            balanceAfter,
            cardVersion,
            write.getDescription(),
            write.getReversesTransactionId(),
            at,
            null
        );
    }

    public boolean isReversal() {
        return source == TransactionSource.REVERSAL;
    }
}
