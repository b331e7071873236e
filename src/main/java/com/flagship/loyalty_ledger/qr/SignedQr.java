package com.flagship.loyalty_ledger.qr;

import lombok.Value;

import java.time.Instant;

@Value
public class SignedQr {
    String raw;
    QrPayload payload;
    Instant expiresAt;
}
