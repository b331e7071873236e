package com.flagship.loyalty_ledger.scan;

public enum ScanOutcome {
    POINTS_AWARDED,
    ENROLLMENT_REQUESTED
}
