package com.flagship.loyalty_ledger.scan;

import com.flagship.loyalty_ledger.exception.ErrorCategory;
import com.flagship.loyalty_ledger.exception.LoyaltyException;

public class InvalidScanRequestException extends LoyaltyException {

    public InvalidScanRequestException(String message) {
        super("INVALID_SCAN_REQUEST", ErrorCategory.VALIDATION, message);
    }
}
