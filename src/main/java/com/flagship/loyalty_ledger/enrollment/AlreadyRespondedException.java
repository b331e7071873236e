package com.flagship.loyalty_ledger.enrollment;

import com.flagship.loyalty_ledger.exception.ErrorCategory;
import com.flagship.loyalty_ledger.exception.LoyaltyException;

import java.util.UUID;

public class AlreadyRespondedException extends LoyaltyException {

    public AlreadyRespondedException(UUID approvalRequestId, Object currentStatus) {
        super("ALREADY_RESPONDED", ErrorCategory.CONFLICT,
            String.format("Approval request %s was already answered (%s)", approvalRequestId, currentStatus));
    }
}
