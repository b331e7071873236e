package com.flagship.loyalty_ledger.enrollment;

import com.flagship.loyalty_ledger.exception.ErrorCategory;
import com.flagship.loyalty_ledger.exception.LoyaltyException;

/**
 * The customer already has a live (not DECLINED or REVOKED) enrollment in the program.
 */
public class AlreadyEnrolledException extends LoyaltyException {

    public AlreadyEnrolledException(String customerId, String programId) {
        super("ALREADY_ENROLLED", ErrorCategory.CONFLICT,
            String.format("Customer %s already has an enrollment in program %s", customerId, programId));
    }
}
