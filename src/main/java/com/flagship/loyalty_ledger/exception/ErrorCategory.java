package com.flagship.loyalty_ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Coarse classification of every rejection the core can produce.
 * Each category has a default HTTP status; individual exceptions may override it.
 */
public enum ErrorCategory {
    VALIDATION(HttpStatus.BAD_REQUEST),
    CONFLICT(HttpStatus.CONFLICT),
    CONCURRENCY(HttpStatus.SERVICE_UNAVAILABLE),
    INTEGRITY(HttpStatus.UNPROCESSABLE_ENTITY),
    SECURITY(HttpStatus.FORBIDDEN);

    private final HttpStatus defaultStatus;

    ErrorCategory(HttpStatus defaultStatus) {
        this.defaultStatus = defaultStatus;
    }

    public HttpStatus getDefaultStatus() {
        return defaultStatus;
    }
}
