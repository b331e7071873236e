package com.flagship.loyalty_ledger.enrollment;

public enum ApprovalStatus {
    PENDING,
    ACCEPTED,
    DECLINED,
    EXPIRED
}
