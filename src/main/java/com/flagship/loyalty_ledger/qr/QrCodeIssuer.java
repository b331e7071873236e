package com.flagship.loyalty_ledger.qr;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

/**
 * Produces signed QR payloads. Rendering them as images happens elsewhere.
 */
@Component
public class QrCodeIssuer {

    private final QrSigner signer;
    private final Clock clock;
    private final Duration maxAge;
    private final SecureRandom random = new SecureRandom();

    public QrCodeIssuer(QrSigner signer, Clock clock,
                        @Value("${loyalty.qr.max-age:5m}") Duration maxAge) {
        this.signer = signer;
        this.clock = clock;
        this.maxAge = maxAge;
    }

    public SignedQr issue(QrType type, String subjectId, String audience) {
        if (type == null || subjectId == null || subjectId.isBlank() || audience == null || audience.isBlank()) {
            throw new IllegalArgumentException("QR type, subject and audience are required");
        }
        Instant now = clock.instant();
        QrPayload payload = new QrPayload(type, subjectId, audience, now, newNonce());
        return new SignedQr(signer.sign(payload), payload, now.plus(maxAge));
    }

    private String newNonce() {
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
