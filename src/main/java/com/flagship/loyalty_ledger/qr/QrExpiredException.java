package com.flagship.loyalty_ledger.qr;

import com.flagship.loyalty_ledger.exception.ErrorCategory;
import com.flagship.loyalty_ledger.exception.LoyaltyException;

public class QrExpiredException extends LoyaltyException {

    public QrExpiredException(String detail) {
        super("QR_EXPIRED", ErrorCategory.SECURITY, "QR payload has expired: " + detail);
    }
}
