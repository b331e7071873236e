package com.flagship.loyalty_ledger.card.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.loyalty_ledger.qr.QrType;
import com.flagship.loyalty_ledger.qr.SignedQr;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class QrPayloadResponse {

    @JsonProperty("qr_payload")
    String qrPayload;

    @JsonProperty("type")
    QrType type;

    @JsonProperty("subject_id")
    String subjectId;

    @JsonProperty("audience")
    String audience;

    @JsonProperty("issued_at")
    Instant issuedAt;

    @JsonProperty("expires_at")
    Instant expiresAt;

    public static QrPayloadResponse from(SignedQr qr) {
        return QrPayloadResponse.builder()
            .qrPayload(qr.getRaw())
            .type(qr.getPayload().getType())
            .subjectId(qr.getPayload().getSubjectId())
            .audience(qr.getPayload().getAudience())
            .issuedAt(qr.getPayload().getIssuedAt())
            .expiresAt(qr.getExpiresAt())
            .build();
    }
}
