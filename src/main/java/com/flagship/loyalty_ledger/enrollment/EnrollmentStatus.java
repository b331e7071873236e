package com.flagship.loyalty_ledger.enrollment;

/**
 * Enrollment lifecycle:
 * INVITED -> PENDING_APPROVAL -> ACTIVE | DECLINED, and ACTIVE -> REVOKED.
 * DECLINED and REVOKED are terminal; a new invitation creates a new enrollment.
 */
public enum EnrollmentStatus {
    INVITED,
    PENDING_APPROVAL,
    ACTIVE,
    DECLINED,
    REVOKED;

    public boolean isTerminal() {
        return this == DECLINED || this == REVOKED;
    }
}
