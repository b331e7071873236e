package com.flagship.loyalty_ledger.notification;

import com.flagship.loyalty_ledger.observability.NotificationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Background relay from the notification outbox to the dispatcher.
 *
 * This component:
 * 1. Polls notification_events for undispatched rows, in write order
 * 2. Hands each one to {@link NotificationDispatcher#publish}
 * 3. Marks it dispatched, or records the failure and retries next poll
 *
 * Rows that fail {@code notifications.relay.max-retries} times stay in the
 * table as dead letters and are reported by the outbox metrics.
 */
@Component
@ConditionalOnProperty(name = "notifications.relay.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class NotificationRelay {

    private final NotificationOutbox outbox;
    private final NotificationDispatcher dispatcher;
    private final NotificationMetrics metrics;

    @Value("${notifications.relay.batch-size:100}")
    private int batchSize;

    @Value("${notifications.relay.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedDelayString = "${notifications.relay.poll-interval-ms:250}")
    public void relayPendingEvents() {
        try {
            List<NotificationEvent> events = outbox.findUndispatched(maxRetries, batchSize);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Relaying {} notification events", events.size());
            for (NotificationEvent event : events) {
                relay(event);
            }
        } catch (Exception e) {
            log.error("Error in notification relay polling loop", e);
        }
    }

    private void relay(NotificationEvent event) {
        try {
            dispatcher.publish(event);
            outbox.markDispatched(event.getId());
            metrics.recordEventDispatched(event.getType().name());
        } catch (Exception e) {
            log.error("Failed to relay notification: eventId={}, type={}, error={}",
                    event.getId(), event.getType(), e.getMessage());
            outbox.markFailed(event.getId(), e.getMessage());
            metrics.recordEventDispatchFailed(event.getType().name());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Notification {} exceeded max retries ({}), leaving as dead letter. type={}, subject={}",
                        event.getId(), maxRetries, event.getType(), event.getSubjectId());
                metrics.recordEventDeadLettered(event.getType().name());
            }
        }
    }

    /**
     * Runs one relay pass immediately.
     */
    public void triggerRelay() {
        relayPendingEvents();
    }
}
