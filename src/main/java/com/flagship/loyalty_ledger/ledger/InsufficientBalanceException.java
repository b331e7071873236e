package com.flagship.loyalty_ledger.ledger;

import com.flagship.loyalty_ledger.exception.ErrorCategory;
import com.flagship.loyalty_ledger.exception.LoyaltyException;

import java.util.UUID;

/**
 * The change would take the balance below zero. Nothing was written.
 */
public class InsufficientBalanceException extends LoyaltyException {

    public InsufficientBalanceException(UUID cardId, long balance, long delta) {
        super("INSUFFICIENT_BALANCE", ErrorCategory.INTEGRITY,
            String.format("Card %s has %d points, cannot apply %d", cardId, balance, delta));
    }
}
