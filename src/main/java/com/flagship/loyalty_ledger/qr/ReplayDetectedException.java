package com.flagship.loyalty_ledger.qr;

import com.flagship.loyalty_ledger.exception.ErrorCategory;
import com.flagship.loyalty_ledger.exception.LoyaltyException;

public class ReplayDetectedException extends LoyaltyException {

    public ReplayDetectedException(String detail) {
        super("REPLAY_DETECTED", ErrorCategory.SECURITY, "QR payload was already presented: " + detail);
    }
}
