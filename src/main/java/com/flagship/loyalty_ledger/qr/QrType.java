package com.flagship.loyalty_ledger.qr;

/**
 * What a QR code identifies. A CUSTOMER code is shown by the customer's app;
 * a LOYALTY_CARD code belongs to one card in one program.
 */
public enum QrType {
    CUSTOMER,
    LOYALTY_CARD
}
