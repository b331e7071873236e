package com.flagship.loyalty_ledger.enrollment;

import com.flagship.loyalty_ledger.exception.ErrorCategory;
import com.flagship.loyalty_ledger.exception.LoyaltyException;

import java.util.UUID;

public class InvalidEnrollmentStateException extends LoyaltyException {

    public InvalidEnrollmentStateException(UUID enrollmentId, EnrollmentStatus status, String action) {
        super("INVALID_ENROLLMENT_STATE", ErrorCategory.CONFLICT,
            String.format("Cannot %s enrollment %s in %s status", action, enrollmentId, status));
    }
}
