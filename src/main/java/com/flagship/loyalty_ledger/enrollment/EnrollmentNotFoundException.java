package com.flagship.loyalty_ledger.enrollment;

import com.flagship.loyalty_ledger.exception.ErrorCategory;
import com.flagship.loyalty_ledger.exception.LoyaltyException;
import org.springframework.http.HttpStatus;

import java.util.UUID;

public class EnrollmentNotFoundException extends LoyaltyException {

    public EnrollmentNotFoundException(UUID enrollmentId) {
        super("ENROLLMENT_NOT_FOUND", ErrorCategory.VALIDATION, "Enrollment not found: " + enrollmentId);
    }

    @Override
    public HttpStatus getHttpStatus() {
        return HttpStatus.NOT_FOUND;
    }
}
