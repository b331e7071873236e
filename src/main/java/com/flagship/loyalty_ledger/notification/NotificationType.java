package com.flagship.loyalty_ledger.notification;

/**
 * Kinds of state change fanned out to customer and business views.
 */
public enum NotificationType {
    BALANCE_CHANGED(true),
    CARD_TIER_CHANGED(true),
    ENROLLMENT_REQUESTED(false),
    ENROLLMENT_ACCEPTED(false),
    ENROLLMENT_DECLINED(false),
    ENROLLMENT_EXPIRED(false),
    ENROLLMENT_REVOKED(false);

    private final boolean coalescable;

    NotificationType(boolean coalescable) {
        this.coalescable = coalescable;
    }

    /**
     * Coalescable events carry a full snapshot, so only the latest one in a
     * burst needs to reach subscribers.
     */
    public boolean isCoalescable() {
        return coalescable;
    }
}
