package com.flagship.loyalty_ledger.notification;

/**
 * Transport for delivering notifications to one subscriber.
 *
 * Implementations get events only. They have no handle on the ledger or the
 * enrollment workflow.
 */
public interface DeliveryChannel {

    /**
     * Delivers one event. Called by at most one thread at a time per subscription.
     *
     * @throws Exception if delivery failed; the dispatcher logs and counts it
     */
    void deliver(NotificationEvent event) throws Exception;

    /**
     * A closed channel is unsubscribed by the dispatcher on its next failure.
     */
    boolean isOpen();

    /**
     * Name used in logs and metric tags.
     */
    String name();
}
