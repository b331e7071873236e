package com.flagship.loyalty_ledger.qr;

import lombok.Value;

import java.time.Instant;

/**
 * Decoded content of a signed QR code.
 *
 * {@code subjectId} is a customer id for CUSTOMER codes and a card id for
 * LOYALTY_CARD codes. {@code audience} is the business allowed to scan it.
 */
@Value
public class QrPayload {
    QrType type;
    String subjectId;
    String audience;
    Instant issuedAt;
    String nonce;
}
