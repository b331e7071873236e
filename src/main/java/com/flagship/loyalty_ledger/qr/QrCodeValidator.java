package com.flagship.loyalty_ledger.qr;

import com.flagship.loyalty_ledger.exception.LoyaltyException;
import com.flagship.loyalty_ledger.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Verifies QR payloads presented by scanners.
 *
 * Checks, in order: signature, decoding, audience, age, nonce. The nonce is
 * only recorded once every other check has passed, so a rejected code does
 * not burn its nonce.
 *
 * Pure validation: nothing here touches ledger or enrollment state.
 */
@Component
@Slf4j
public class QrCodeValidator {

    private final QrSigner signer;
    private final NonceReplayCache replayCache;
    private final LedgerMetrics metrics;
    private final Clock clock;
    private final Duration maxAge;
    private final Duration clockSkew;

    public QrCodeValidator(QrSigner signer,
                           NonceReplayCache replayCache,
                           LedgerMetrics metrics,
                           Clock clock,
                           @Value("${loyalty.qr.max-age:5m}") Duration maxAge,
                           @Value("${loyalty.qr.clock-skew:30s}") Duration clockSkew) {
        this.signer = signer;
        this.replayCache = replayCache;
        this.metrics = metrics;
        this.clock = clock;
        this.maxAge = maxAge;
        this.clockSkew = clockSkew;
    }

    /**
     * @param rawPayload       Payload string as read from the code
     * @param expectedAudience Business performing the scan
     * @return The decoded payload, first presentation only
     * @throws InvalidSignatureException    if tampered with or malformed
     * @throws QrAudienceMismatchException  if issued for another business
     * @throws QrExpiredException           if older than the max age, or issued in the future
     * @throws ReplayDetectedException      if its nonce was seen before
     */
    public QrPayload validate(String rawPayload, String expectedAudience) {
        try {
            QrPayload payload = signer.verify(rawPayload);

            if (!payload.getAudience().equals(expectedAudience)) {
                throw new QrAudienceMismatchException(
                    "issued for " + payload.getAudience() + ", scanned by " + expectedAudience);
            }

            Instant now = clock.instant();
            if (payload.getIssuedAt().isAfter(now.plus(clockSkew))) {
                throw new QrExpiredException("issued in the future at " + payload.getIssuedAt());
            }
            if (payload.getIssuedAt().plus(maxAge).isBefore(now)) {
                throw new QrExpiredException("issued at " + payload.getIssuedAt() + ", max age " + maxAge);
            }

            if (!replayCache.markFirstSeen(payload.getNonce(), maxAge.plus(clockSkew))) {
                throw new ReplayDetectedException("nonce " + payload.getNonce());
            }

            log.debug("Accepted {} QR for subject {}", payload.getType(), payload.getSubjectId());
            return payload;

        } catch (LoyaltyException e) {
            metrics.recordQrRejected(e.getCode());
            throw e;
        }
    }
}
