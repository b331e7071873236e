package com.flagship.loyalty_ledger.enrollment;

import com.flagship.loyalty_ledger.exception.ErrorCategory;
import com.flagship.loyalty_ledger.exception.LoyaltyException;

public class ConcurrentEnrollmentModificationException extends LoyaltyException {

    public ConcurrentEnrollmentModificationException(String subject, Throwable cause) {
        super("CONCURRENT_MODIFICATION", ErrorCategory.CONCURRENCY,
            subject + " is being modified concurrently, retry later", cause);
    }
}
