package com.flagship.loyalty_ledger.qr;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Base64;

/**
 * Encodes and verifies the QR wire format:
 * {@code base64url(json) + "." + base64url(HMAC-SHA256(secret, base64url(json)))}.
 *
 * JSON keys: typ, sub, aud, iat (epoch millis), nonce.
 */
@Component
public class QrSigner {

    private static final String ALGORITHM = "HmacSHA256";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final byte[] secret;
    private final ObjectMapper objectMapper;

    public QrSigner(@Value("${loyalty.qr.secret}") String secret, ObjectMapper objectMapper) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("loyalty.qr.secret must be configured");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.objectMapper = objectMapper;
    }

    public String sign(QrPayload payload) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("typ", payload.getType().name());
        node.put("sub", payload.getSubjectId());
        node.put("aud", payload.getAudience());
        node.put("iat", payload.getIssuedAt().toEpochMilli());
        node.put("nonce", payload.getNonce());

        String body;
        try {
            body = ENCODER.encodeToString(objectMapper.writeValueAsBytes(node));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode QR payload", e);
        }
        return body + "." + ENCODER.encodeToString(hmac(body));
    }

    /**
     * Checks the signature, then decodes the body.
     *
     * @throws InvalidSignatureException if the structure, signature or body is not valid
     */
    public QrPayload verify(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidSignatureException("empty payload");
        }
        int dot = raw.indexOf('.');
        if (dot <= 0 || dot != raw.lastIndexOf('.') || dot == raw.length() - 1) {
            throw new InvalidSignatureException("malformed payload");
        }
        String body = raw.substring(0, dot);

        byte[] presented;
        try {
            presented = DECODER.decode(raw.substring(dot + 1));
        } catch (IllegalArgumentException e) {
            throw new InvalidSignatureException("signature is not base64url");
        }
        if (!MessageDigest.isEqual(hmac(body), presented)) {
            throw new InvalidSignatureException("signature mismatch");
        }
        return decode(body);
    }

    private QrPayload decode(String body) {
        try {
            JsonNode node = objectMapper.readTree(DECODER.decode(body));
            QrType type = QrType.valueOf(requiredText(node, "typ"));
            JsonNode iat = node.get("iat");
            if (iat == null || !iat.canConvertToLong()) {
                throw new InvalidSignatureException("missing iat");
            }
            return new QrPayload(type, requiredText(node, "sub"), requiredText(node, "aud"),
                Instant.ofEpochMilli(iat.asLong()), requiredText(node, "nonce"));
        } catch (IOException | IllegalArgumentException e) {
            throw new InvalidSignatureException("undecodable body");
        }
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new InvalidSignatureException("missing " + field);
        }
        return value.asText();
    }

    private byte[] hmac(String body) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret, ALGORITHM));
            return mac.doFinal(body.getBytes(StandardCharsets.US_ASCII));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }
}
