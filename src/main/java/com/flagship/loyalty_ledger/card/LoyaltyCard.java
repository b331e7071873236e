package com.flagship.loyalty_ledger.card;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Loyalty card domain object.
 *
 * The balance held here is the only stored balance in the system. Lifetime
 * earned and redeemed totals are derived from the transaction log on read.
 *
 * State changes return a new instance; invalid changes are rejected with
 * {@link IllegalStateException}.
 */
@Value
public class LoyaltyCard {
    UUID id;
    UUID enrollmentId;
    String customerId;
    String programId;
    String businessId;
    String cardNumber;
    long balance;
    CardTier tier;
    CardStatus status;
    long version;
    Instant createdAt;
    Instant updatedAt;
    Instant deactivatedAt;

    public boolean isActive() {
        return status == CardStatus.ACTIVE;
    }

    /**
     * Applies a signed point delta and recomputes the tier.
     *
     * @throws IllegalStateException if the card is inactive or the balance would go negative
     */
    public LoyaltyCard applyDelta(long delta, Instant at) {
        if (!isActive()) {
            throw new IllegalStateException("Card " + id + " is " + status);
        }
        long newBalance = balance + delta;
        if (newBalance < 0) {
            throw new IllegalStateException(
                String.format("Card %s balance %d cannot absorb delta %d", id, balance, delta));
        }
        return new LoyaltyCard(id, enrollmentId, customerId, programId, businessId, cardNumber,
            newBalance, CardTier.forBalance(newBalance), status, version, createdAt, at, deactivatedAt);
    }

    /**
     * Deactivates the card. Deactivating an inactive card is a no-op.
     */
    public LoyaltyCard deactivate(Instant at) {
        if (!isActive()) {
            return this;
        }
        return new LoyaltyCard(id, enrollmentId, customerId, programId, businessId, cardNumber,
            balance, tier, CardStatus.INACTIVE, version, createdAt, at, at);
    }
}
