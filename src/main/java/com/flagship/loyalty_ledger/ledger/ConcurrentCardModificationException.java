package com.flagship.loyalty_ledger.ledger;

import com.flagship.loyalty_ledger.exception.ErrorCategory;
import com.flagship.loyalty_ledger.exception.LoyaltyException;

import java.util.UUID;

/**
 * Lock contention on a card outlasted the retry budget. Safe to retry with
 * the same idempotency key.
 */
public class ConcurrentCardModificationException extends LoyaltyException {

    public ConcurrentCardModificationException(UUID cardId, Throwable cause) {
        super("CONCURRENT_MODIFICATION", ErrorCategory.CONCURRENCY,
            "Card " + cardId + " is being modified concurrently, retry later", cause);
    }
}
