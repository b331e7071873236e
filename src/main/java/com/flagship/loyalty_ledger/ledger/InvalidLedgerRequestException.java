package com.flagship.loyalty_ledger.ledger;

import com.flagship.loyalty_ledger.exception.ErrorCategory;
import com.flagship.loyalty_ledger.exception.LoyaltyException;

public class InvalidLedgerRequestException extends LoyaltyException {

    public InvalidLedgerRequestException(String message) {
        super("INVALID_LEDGER_REQUEST", ErrorCategory.VALIDATION, message);
    }
}
