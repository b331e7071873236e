package com.flagship.loyalty_ledger.enrollment;

import com.flagship.loyalty_ledger.exception.ErrorCategory;
import com.flagship.loyalty_ledger.exception.LoyaltyException;

import java.time.Instant;
import java.util.UUID;

public class RequestExpiredException extends LoyaltyException {

    public RequestExpiredException(UUID approvalRequestId, Instant expiresAt) {
        super("REQUEST_EXPIRED", ErrorCategory.CONFLICT,
            String.format("Approval request %s expired at %s", approvalRequestId, expiresAt));
    }
}
