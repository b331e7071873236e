package com.flagship.loyalty_ledger.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * Outcome of a balance change. A replayed result is the one recorded by the
 * first successful call with the same idempotency key.
 */
@Value
public class LedgerResult {
    UUID transactionId;
    UUID cardId;
    long newBalance;
    long cardVersion;
    boolean replayed;

    static LedgerResult applied(PointTransaction transaction) {
        return new LedgerResult(transaction.getId(), transaction.getCardId(),
            transaction.getBalanceAfter(), transaction.getCardVersion(), false);
    }

    static LedgerResult replayOf(PointTransaction transaction) {
        return new LedgerResult(transaction.getId(), transaction.getCardId(),
            transaction.getBalanceAfter(), transaction.getCardVersion(), true);
    }
}
