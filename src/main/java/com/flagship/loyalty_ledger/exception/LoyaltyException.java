package com.flagship.loyalty_ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Base type for all domain rejections.
 *
 * Carries a stable machine-readable code (e.g. INSUFFICIENT_BALANCE) and a
 * category. No state has been changed when one of these is thrown.
 */
public abstract class LoyaltyException extends RuntimeException {

    private final String code;
    private final ErrorCategory category;

    protected LoyaltyException(String code, ErrorCategory category, String message) {
        super(message);
        this.code = code;
        this.category = category;
    }

    protected LoyaltyException(String code, ErrorCategory category, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.category = category;
    }

    public String getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public HttpStatus getHttpStatus() {
        return category.getDefaultStatus();
    }
}
