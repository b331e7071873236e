package com.flagship.loyalty_ledger.observability;

import com.flagship.loyalty_ledger.notification.NotificationEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the notification outbox and fan-out.
 *
 * Gauges read cached values refreshed by {@link MetricsScheduler}, so a
 * scrape never hits the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationMetrics {

    private final NotificationEventRepository repository;
    private final MeterRegistry meterRegistry;

    @Value("${notifications.relay.max-retries:5}")
    private int maxRetries;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadLetterCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("notifications.outbox.backlog.size", backlogSize, AtomicLong::get)
                .description("Number of notification events not yet dispatched")
                .register(meterRegistry);

        Gauge.builder("notifications.outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest undispatched notification in seconds")
                .register(meterRegistry);

        Gauge.builder("notifications.outbox.dead_letters", deadLetterCount, AtomicLong::get)
                .description("Notifications that exceeded the relay retry limit")
                .register(meterRegistry);

        log.info("Notification metrics registered with Micrometer");
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            long undispatched = repository.countUndispatched();
            backlogSize.set(undispatched);

            repository.findOldestUndispatchedCreatedAt()
                    .ifPresentOrElse(
                            oldest -> oldestEventAgeSeconds.set(
                                    Math.max(0, Duration.between(oldest, Instant.now()).getSeconds())),
                            () -> oldestEventAgeSeconds.set(0)
                    );

            long deadLetters = repository.countByDispatchedAtIsNullAndRetryCountGreaterThanEqual(maxRetries);
            deadLetterCount.set(deadLetters);

            log.debug("Notification metrics refreshed: backlog={}, oldestAge={}s, deadLetters={}",
                    undispatched, oldestEventAgeSeconds.get(), deadLetters);
        } catch (Exception e) {
            log.warn("Failed to refresh notification metrics: {}", e.getMessage());
        }
    }

    public long getBacklogSize() {
        return backlogSize.get();
    }

    public void recordEventDispatched(String type) {
        meterRegistry.counter("notifications.relayed", "type", type, "status", "success").increment();
    }

    public void recordEventDispatchFailed(String type) {
        meterRegistry.counter("notifications.relayed", "type", type, "status", "failure").increment();
    }

    public void recordEventDeadLettered(String type) {
        meterRegistry.counter("notifications.dead_lettered", "type", type).increment();
    }

    public void recordCoalesced(String type) {
        meterRegistry.counter("notifications.coalesced", "type", type).increment();
    }

    public void recordDelivered(String type, String channel) {
        meterRegistry.counter("notifications.delivered", "type", type, "channel", channel).increment();
    }

    public void recordDeliveryFailed(String type, String channel) {
        meterRegistry.counter("notifications.delivery_failed", "type", type, "channel", channel).increment();
    }

    public void recordRedelivery(String type, String channel) {
        meterRegistry.counter("notifications.redelivered", "type", type, "channel", channel).increment();
    }

    /**
     * @param reason "duplicate", "stale" or "undeliverable"
     */
    public void recordDropped(String type, String reason) {
        meterRegistry.counter("notifications.dropped", "type", type, "reason", reason).increment();
    }
}
