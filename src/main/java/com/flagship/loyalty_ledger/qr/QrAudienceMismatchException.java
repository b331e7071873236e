package com.flagship.loyalty_ledger.qr;

import com.flagship.loyalty_ledger.exception.ErrorCategory;
import com.flagship.loyalty_ledger.exception.LoyaltyException;

public class QrAudienceMismatchException extends LoyaltyException {

    public QrAudienceMismatchException(String detail) {
        super("QR_AUDIENCE_MISMATCH", ErrorCategory.SECURITY, "QR payload was issued for a different business: " + detail);
    }
}
