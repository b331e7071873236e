package com.flagship.loyalty_ledger.notification;

import java.util.UUID;

/**
 * Thrown by {@link NotificationDispatcher#publish} when at least one open
 * subscription failed to take the event. The relay records the failure on the
 * outbox row and publishes it again on a later poll; subscriptions that did
 * receive it skip the repeat by dedupe key.
 */
public class NotificationDeliveryException extends RuntimeException {

    private final UUID eventId;
    private final int failedSubscriptions;

    public NotificationDeliveryException(NotificationEvent event, int failedSubscriptions, Throwable lastFailure) {
        super(String.format("%s %s not delivered to %d subscription(s): %s",
                event.getType(), event.getDedupeKey(), failedSubscriptions,
                lastFailure != null ? lastFailure.getMessage() : "unknown"),
            lastFailure);
        this.eventId = event.getId();
        this.failedSubscriptions = failedSubscriptions;
    }

    public UUID getEventId() {
        return eventId;
    }

    public int getFailedSubscriptions() {
        return failedSubscriptions;
    }
}
