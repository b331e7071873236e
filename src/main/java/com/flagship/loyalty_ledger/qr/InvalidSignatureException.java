package com.flagship.loyalty_ledger.qr;

import com.flagship.loyalty_ledger.exception.ErrorCategory;
import com.flagship.loyalty_ledger.exception.LoyaltyException;

public class InvalidSignatureException extends LoyaltyException {

    public InvalidSignatureException(String detail) {
        super("INVALID_SIGNATURE", ErrorCategory.SECURITY, "QR payload signature is invalid: " + detail);
    }
}
