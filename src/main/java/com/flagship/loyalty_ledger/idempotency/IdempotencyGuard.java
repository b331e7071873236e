package com.flagship.loyalty_ledger.idempotency;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps caller-supplied idempotency keys to the transaction they produced.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable or evicted)
 * 2. Fall back to the unique idempotency_key column on point_transactions
 * 3. Back-fill Redis on a database hit
 *
 * The database is the source of truth and never expires a key. Redis only
 * accelerates lookups, so losing it costs latency, never correctness.
 */
@Service
@Slf4j
public class IdempotencyGuard {

    private static final String REDIS_KEY_PREFIX = "loyalty:idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final JdbcTemplate jdbcTemplate;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyGuard(JdbcTemplate jdbcTemplate, Optional<StringRedisTemplate> redisTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.redisTemplate = redisTemplate;
    }

    /**
     * Looks up the transaction recorded for a key.
     *
     * @param idempotencyKey Caller-supplied key
     * @return Transaction id if the key has already been applied
     */
    public Optional<UUID> findRecorded(String idempotencyKey) {
        requireKey(idempotencyKey);

        Optional<UUID> cached = readCache(idempotencyKey);
        if (cached.isPresent()) {
            log.debug("Idempotency key found in Redis: {}", idempotencyKey);
            return cached;
        }

        Optional<UUID> recorded = findRecordedInDatabase(idempotencyKey);
        recorded.ifPresent(transactionId -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            writeCache(idempotencyKey, transactionId);
        });
        return recorded;
    }

    /**
     * Database-only lookup. Used under the card lock, where a stale cache
     * answer would not be good enough.
     */
    public Optional<UUID> findRecordedInDatabase(String idempotencyKey) {
        requireKey(idempotencyKey);
        List<UUID> ids = jdbcTemplate.queryForList(
            "SELECT id FROM point_transactions WHERE idempotency_key = ?", UUID.class, idempotencyKey);
        return ids.stream().findFirst();
    }

    /**
     * Caches a key after its transaction committed. Best effort.
     */
    public void remember(String idempotencyKey, UUID transactionId) {
        requireKey(idempotencyKey);
        if (transactionId == null) {
            throw new IllegalArgumentException("Transaction ID cannot be null");
        }
        writeCache(idempotencyKey, transactionId);
    }

    private Optional<UUID> readCache(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String value = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
            return value == null ? Optional.empty() : Optional.of(UUID.fromString(value));
        } catch (RuntimeException e) {
            log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                    idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String idempotencyKey, UUID transactionId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue()
                .set(REDIS_KEY_PREFIX + idempotencyKey, transactionId.toString(), REDIS_TTL);
        } catch (RuntimeException e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
