package com.flagship.loyalty_ledger.observability;

import com.flagship.loyalty_ledger.enrollment.ApprovalRequestRepository;
import com.flagship.loyalty_ledger.enrollment.ApprovalStatus;
import com.flagship.loyalty_ledger.notification.NotificationEventRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Actuator health contributors for the parts of the pipeline that can fall
 * behind without failing outright.
 */
public class HealthIndicators {

    /**
     * Reports the undispatched backlog and the dead letters the relay gave up on.
     * DOWN once the backlog passes {@code notifications.health.backlog-critical}.
     */
    @Component("notificationOutboxHealth")
    public static class NotificationOutboxHealthIndicator implements HealthIndicator {

        private final NotificationEventRepository repository;
        private final int maxRetries;
        private final long backlogWarning;
        private final long backlogCritical;

        public NotificationOutboxHealthIndicator(
                NotificationEventRepository repository,
                @Value("${notifications.relay.max-retries:5}") int maxRetries,
                @Value("${notifications.health.backlog-warning:1000}") long backlogWarning,
                @Value("${notifications.health.backlog-critical:10000}") long backlogCritical) {
            this.repository = repository;
            this.maxRetries = maxRetries;
            this.backlogWarning = backlogWarning;
            this.backlogCritical = backlogCritical;
        }

        @Override
        public Health health() {
            try {
                long backlog = repository.countUndispatched();
                long deadLetters = repository.countByDispatchedAtIsNullAndRetryCountGreaterThanEqual(maxRetries);

                Health.Builder builder;
                if (backlog >= backlogCritical) {
                    builder = Health.down();
                } else if (backlog >= backlogWarning || deadLetters > 0) {
                    builder = Health.status("WARNING");
                } else {
                    builder = Health.up();
                }
                return builder
                        .withDetail("backlog", backlog)
                        .withDetail("deadLetters", deadLetters)
                        .withDetail("backlogCritical", backlogCritical)
                        .build();
            } catch (Exception e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Pending approvals that are past their deadline but not yet marked EXPIRED.
     * A growing count means the expiry sweeper is not running.
     */
    @Component("approvalExpiryHealth")
    public static class ApprovalExpiryHealthIndicator implements HealthIndicator {

        private final ApprovalRequestRepository repository;
        private final Clock clock;
        private final Duration grace;

        public ApprovalExpiryHealthIndicator(
                ApprovalRequestRepository repository,
                Clock clock,
                @Value("${loyalty.enrollment.expiry-health-grace:PT10M}") Duration grace) {
            this.repository = repository;
            this.clock = clock;
            this.grace = grace;
        }

        @Override
        public Health health() {
            try {
                long overdue = repository.countByStatusAndExpiresAtLessThanEqual(
                        ApprovalStatus.PENDING, clock.instant().minus(grace));
                Health.Builder builder = overdue == 0 ? Health.up() : Health.status("WARNING");
                return builder
                        .withDetail("overduePendingApprovals", overdue)
                        .withDetail("grace", grace.toString())
                        .build();
            } catch (Exception e) {
                return Health.down(e).build();
            }
        }
    }

    /**
     * Redis is an accelerator for idempotency lookups and the QR nonce cache.
     * Both keep working without it, so an outage is DEGRADED rather than DOWN.
     */
    @Component("redisFastPathHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                String pong = redisTemplate.execute(connection -> connection.ping(), true);
                if ("PONG".equals(pong)) {
                    return Health.up().build();
                }
                return degraded("unexpected ping reply: " + pong);
            } catch (Exception e) {
                return degraded(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }

        private static Health degraded(String reason) {
            return Health.status("DEGRADED")
                    .withDetail("reason", reason)
                    .withDetail("idempotency", "database lookup")
                    .withDetail("qrNonces", "node-local cache")
                    .build();
        }
    }

    @Component("kafkaNotificationHealth")
    @ConditionalOnProperty(name = "notifications.kafka.enabled", havingValue = "true")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var producerMetrics = kafkaTemplate.metrics();
                if (producerMetrics.isEmpty()) {
                    return Health.down().withDetail("reason", "producer not connected").build();
                }
                return Health.up()
                        .withDetail("producerMetrics", producerMetrics.size())
                        .build();
            } catch (Exception e) {
                return Health.down(e).build();
            }
        }
    }
}
