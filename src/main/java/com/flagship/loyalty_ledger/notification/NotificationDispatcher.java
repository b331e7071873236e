package com.flagship.loyalty_ledger.notification;

import com.flagship.loyalty_ledger.observability.NotificationMetrics;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fans out notification events to live subscriptions.
 *
 * Delivery rules:
 * - A subscription receives events whose targetId equals its own, or every
 *   event if it subscribed to {@link #ALL_TARGETS}.
 * - Snapshot events (balance, tier) arriving within the coalescing window for
 *   the same (type, target, subject) collapse into the one with the highest
 *   sequence.
 * - Per subscription, an event whose sequence is not above the last one
 *   delivered for the same stream is dropped, so an older balance never
 *   overwrites a newer one on screen.
 * - Per subscription, a dedupe key already delivered is dropped.
 *
 * Failures on a channel that is still open are never silently dropped:
 * - Events delivered inline make {@link #publish} throw
 *   {@link NotificationDeliveryException}, so the relay leaves the outbox row
 *   undispatched and publishes it again later.
 * - Coalesced events are flushed off the relay thread; a failed flush is
 *   redelivered to that subscription with a growing delay, up to
 *   {@code notifications.redelivery.max-attempts} times.
 * The dedupe and stale checks make both forms of redelivery harmless for
 * subscriptions that already have the event.
 *
 * The dispatcher is fed exclusively by {@link NotificationRelay} from the
 * outbox. It has no reference to any writer.
 */
@Component
@Slf4j
public class NotificationDispatcher {

    public static final String ALL_TARGETS = "*";

    private static final int DEDUPE_MEMORY = 1024;

    private final NotificationMetrics metrics;
    private final TaskScheduler scheduler;
    private final long coalesceWindowMs;
    private final int maxRedeliveryAttempts;
    private final Map<UUID, ChannelSubscription> subscriptions = new ConcurrentHashMap<>();
    private final Map<String, NotificationEvent> pending = new ConcurrentHashMap<>();

    public NotificationDispatcher(NotificationMetrics metrics,
                                  TaskScheduler scheduler,
                                  @Value("${notifications.coalesce-window-ms:500}") long coalesceWindowMs,
                                  @Value("${notifications.redelivery.max-attempts:5}") int maxRedeliveryAttempts) {
        this.metrics = metrics;
        this.scheduler = scheduler;
        this.coalesceWindowMs = coalesceWindowMs;
        this.maxRedeliveryAttempts = maxRedeliveryAttempts;
    }

    /**
     * Publishes an event to all matching subscriptions.
     *
     * @throws NotificationDeliveryException if an open subscription failed to
     *         take an inline event; the others have received it
     */
    public void publish(NotificationEvent event) {
        if (event.getType().isCoalescable() && coalesceWindowMs > 0) {
            enqueue(event);
            return;
        }
        List<ChannelSubscription> failed = new ArrayList<>();
        Exception lastFailure = null;
        for (ChannelSubscription subscription : matching(event)) {
            Exception failure = subscription.offer(event);
            if (failure != null && subscription.isActive()) {
                failed.add(subscription);
                lastFailure = failure;
            }
        }
        if (!failed.isEmpty()) {
            throw new NotificationDeliveryException(event, failed.size(), lastFailure);
        }
    }

    /**
     * Registers a channel for a target.
     *
     * @param targetId Customer or business id, or {@link #ALL_TARGETS}
     * @param channel  Transport to deliver through
     * @return Handle used to cancel the subscription
     */
    public Subscription subscribe(String targetId, DeliveryChannel channel) {
        if (targetId == null || targetId.isBlank()) {
            throw new IllegalArgumentException("Subscription target cannot be blank");
        }
        ChannelSubscription subscription = new ChannelSubscription(UUID.randomUUID(), targetId, channel);
        subscriptions.put(subscription.id(), subscription);
        log.debug("Subscribed {} channel {} to target {}", channel.name(), subscription.id(), targetId);
        return subscription;
    }

    public int activeSubscriptionCount() {
        return subscriptions.size();
    }

    /**
     * Delivers everything still waiting in a coalescing window.
     */
    public void flushPending() {
        for (String key : List.copyOf(pending.keySet())) {
            flush(key);
        }
    }

    @PreDestroy
    public void shutdown() {
        flushPending();
    }

    private void enqueue(NotificationEvent event) {
        String key = event.coalescingKey();
        boolean[] opened = {false};
        pending.compute(key, (k, current) -> {
            if (current == null) {
                opened[0] = true;
                return event;
            }
            metrics.recordCoalesced(event.getType().name());
            return event.getSequence() >= current.getSequence() ? event : current;
        });
        if (opened[0]) {
            scheduler.schedule(() -> flush(key), Instant.now().plusMillis(coalesceWindowMs));
        }
    }

    private void flush(String key) {
        NotificationEvent latest = pending.remove(key);
        if (latest == null) {
            return;
        }
        for (ChannelSubscription subscription : matching(latest)) {
            if (subscription.offer(latest) != null && subscription.isActive()) {
                scheduleRedelivery(subscription, latest, 1);
            }
        }
    }

    private void scheduleRedelivery(ChannelSubscription subscription, NotificationEvent event, int attempt) {
        if (attempt > maxRedeliveryAttempts) {
            metrics.recordDropped(event.getType().name(), "undeliverable");
            log.warn("Giving up on {} {} for {} subscription {} after {} redeliveries",
                    event.getType(), event.getDedupeKey(), subscription.channel.name(),
                    subscription.id(), maxRedeliveryAttempts);
            return;
        }
        Duration delay = Duration.ofMillis(Math.max(coalesceWindowMs, 50) * attempt);
        scheduler.schedule(() -> {
            if (!subscription.isActive()) {
                return;
            }
            metrics.recordRedelivery(event.getType().name(), subscription.channel.name());
            if (subscription.offer(event) != null && subscription.isActive()) {
                scheduleRedelivery(subscription, event, attempt + 1);
            }
        }, Instant.now().plus(delay));
    }

    private List<ChannelSubscription> matching(NotificationEvent event) {
        List<ChannelSubscription> matches = new ArrayList<>();
        for (ChannelSubscription subscription : subscriptions.values()) {
            if (subscription.matches(event.getTargetId())) {
                matches.add(subscription);
            }
        }
        return matches;
    }

    private final class ChannelSubscription implements Subscription {

        private final UUID id;
        private final String targetId;
        private final DeliveryChannel channel;
        private volatile boolean active = true;

        // guarded by this
        private final Map<String, Long> lastSequenceByStream = new HashMap<>();
        private final Set<String> recentDedupeKeys = Collections.newSetFromMap(
            new LinkedHashMap<String, Boolean>() {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                    return size() > DEDUPE_MEMORY;
                }
            });

        ChannelSubscription(UUID id, String targetId, DeliveryChannel channel) {
            this.id = id;
            this.targetId = targetId;
            this.channel = channel;
        }

        boolean matches(String eventTarget) {
            return ALL_TARGETS.equals(targetId) || targetId.equals(eventTarget);
        }

        /**
         * @return the delivery failure, or null if the event was delivered or
         *         deliberately skipped
         */
        synchronized Exception offer(NotificationEvent event) {
            if (!active) {
                return null;
            }
            if (recentDedupeKeys.contains(event.getDedupeKey())) {
                metrics.recordDropped(event.getType().name(), "duplicate");
                return null;
            }
            String stream = event.getTargetId() + "|" + event.getSubjectId() + "|" + event.getType();
            if (event.getSequence() > 0) {
                Long last = lastSequenceByStream.get(stream);
                if (last != null && event.getSequence() <= last) {
                    metrics.recordDropped(event.getType().name(), "stale");
                    log.debug("Dropped stale {} for subject {}: sequence {} <= {}",
                            event.getType(), event.getSubjectId(), event.getSequence(), last);
                    return null;
                }
            }

            try {
                channel.deliver(event);
            } catch (Exception e) {
                metrics.recordDeliveryFailed(event.getType().name(), channel.name());
                log.warn("Delivery of {} to {} subscription {} failed: {}",
                        event.getType(), channel.name(), id, e.getMessage());
                if (!channel.isOpen()) {
                    cancel();
                }
                return e;
            }
            recentDedupeKeys.add(event.getDedupeKey());
            if (event.getSequence() > 0) {
                lastSequenceByStream.put(stream, event.getSequence());
            }
            metrics.recordDelivered(event.getType().name(), channel.name());
            return null;
        }

        @Override
        public UUID id() {
            return id;
        }

        @Override
        public String targetId() {
            return targetId;
        }

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void cancel() {
            if (active) {
                active = false;
                subscriptions.remove(id);
                log.debug("Cancelled {} subscription {} for target {}", channel.name(), id, targetId);
            }
        }
    }
}
