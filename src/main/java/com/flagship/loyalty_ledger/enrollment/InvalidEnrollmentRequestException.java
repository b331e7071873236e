package com.flagship.loyalty_ledger.enrollment;

import com.flagship.loyalty_ledger.exception.ErrorCategory;
import com.flagship.loyalty_ledger.exception.LoyaltyException;

public class InvalidEnrollmentRequestException extends LoyaltyException {

    public InvalidEnrollmentRequestException(String message) {
        super("INVALID_ENROLLMENT_REQUEST", ErrorCategory.VALIDATION, message);
    }
}
