package com.flagship.loyalty_ledger.ledger;

import com.flagship.loyalty_ledger.exception.ErrorCategory;
import com.flagship.loyalty_ledger.exception.LoyaltyException;
import org.springframework.http.HttpStatus;

import java.util.UUID;

public class TransactionNotFoundException extends LoyaltyException {

    public TransactionNotFoundException(UUID transactionId) {
        super("TRANSACTION_NOT_FOUND", ErrorCategory.VALIDATION, "Point transaction not found: " + transactionId);
    }

    @Override
    public HttpStatus getHttpStatus() {
        return HttpStatus.NOT_FOUND;
    }
}
