package com.flagship.loyalty_ledger.notification;

import java.util.UUID;

/**
 * Handle returned by {@link NotificationDispatcher#subscribe}.
 */
public interface Subscription {

    UUID id();

    String targetId();

    boolean isActive();

    /**
     * Stops delivery. Idempotent.
     */
    void cancel();
}
