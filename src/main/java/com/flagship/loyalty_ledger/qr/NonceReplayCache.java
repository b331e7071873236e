package com.flagship.loyalty_ledger.qr;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers QR nonces for the validity window of a code.
 *
 * Redis {@code SET NX} with a TTL when available; otherwise, or while Redis is
 * failing, an in-process map whose entries expire after the same TTL.
 * Entries are only ever added.
 */
@Component
@Slf4j
public class NonceReplayCache {

    private static final String REDIS_KEY_PREFIX = "loyalty:qr:nonce:";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final Clock clock;
    private final Map<String, Instant> localNonces = new ConcurrentHashMap<>();

    public NonceReplayCache(Optional<StringRedisTemplate> redisTemplate, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
    }

    /**
     * Records a nonce.
     *
     * @return true on first sight, false if it is already in the cache
     */
    public boolean markFirstSeen(String nonce, Duration ttl) {
        if (redisTemplate.isPresent()) {
            try {
                Boolean stored = redisTemplate.get().opsForValue()
                    .setIfAbsent(REDIS_KEY_PREFIX + nonce, "1", ttl);
                if (stored != null) {
                    return stored;
                }
            } catch (RuntimeException e) {
                log.warn("Redis replay cache unavailable, using local cache: {}", e.getMessage());
            }
        }
        return markLocally(nonce, ttl);
    }

    private boolean markLocally(String nonce, Duration ttl) {
        Instant now = clock.instant();
        localNonces.values().removeIf(expiry -> !expiry.isAfter(now));
        Instant expiry = now.plus(ttl);
        return localNonces.putIfAbsent(nonce, expiry) == null;
    }

    int localSize() {
        return localNonces.size();
    }
}
