package com.flagship.loyalty_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger, enrollment and QR operations.
 *
 * Metrics exposed:
 * - ledger.deltas: applied and rejected balance changes, by source and outcome
 * - ledger.points: absolute points moved, by direction
 * - ledger.latency: applyDelta latency
 * - idempotency.cache: hit/miss of idempotency lookups
 * - ledger.lock.retries: retries caused by lock contention
 * - enrollment.transitions: enrollment state changes, by target status
 * - qr.rejections: rejected QR payloads, by reason
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Timer applyTimer;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.applyTimer = Timer.builder("ledger.latency")
                .description("Time taken to apply a point delta")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordDeltaApplied(String source, long delta) {
        registry.counter("ledger.deltas", "source", sanitizeTag(source), "outcome", "applied").increment();
        registry.counter("ledger.points", "direction", delta > 0 ? "credit" : "debit").increment(Math.abs(delta));
    }

    public void recordDeltaRejected(String source, String code) {
        registry.counter("ledger.deltas",
                "source", sanitizeTag(source),
                "outcome", sanitizeTag(code)
        ).increment();
    }

    public void recordLatency(Duration duration) {
        applyTimer.record(duration);
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordLockRetry(String operation) {
        registry.counter("ledger.lock.retries", "operation", sanitizeTag(operation)).increment();
    }

    public void recordEnrollmentTransition(String status) {
        registry.counter("enrollment.transitions", "status", sanitizeTag(status)).increment();
    }

    public void recordQrRejected(String reason) {
        registry.counter("qr.rejections", "reason", sanitizeTag(reason)).increment();
    }

    /**
     * Sanitizes tag values to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        String sanitized = value.length() > 50 ? value.substring(0, 50) : value;
        return sanitized.toLowerCase().replaceAll("[^a-z0-9_]", "_");
    }
}
