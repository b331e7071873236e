package com.flagship.loyalty_ledger.enrollment;

import com.flagship.loyalty_ledger.exception.ErrorCategory;
import com.flagship.loyalty_ledger.exception.LoyaltyException;
import org.springframework.http.HttpStatus;

public class ApprovalRequestNotFoundException extends LoyaltyException {

    public ApprovalRequestNotFoundException(String message) {
        super("APPROVAL_REQUEST_NOT_FOUND", ErrorCategory.VALIDATION, message);
    }

    @Override
    public HttpStatus getHttpStatus() {
        return HttpStatus.NOT_FOUND;
    }
}
