package com.flagship.loyalty_ledger.card;

/**
 * Card status. Cards are never deleted; a revoked enrollment leaves an INACTIVE card.
 */
public enum CardStatus {
    ACTIVE,
    INACTIVE
}
