package com.flagship.loyalty_ledger.card;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for loyalty cards.
 *
 * Rows are inserted by {@link CardRegistry#ensureCard(UUID)} with a plain
 * INSERT ... ON CONFLICT so that concurrent issuance collapses to one row.
 * After that the entity is only mutated through {@link #updateFromDomain(LoyaltyCard)},
 * and every update bumps {@code version}.
 */
@Entity
@Table(name = "loyalty_cards")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LoyaltyCardEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "enrollment_id", nullable = false, updatable = false)
    private UUID enrollmentId;

    @Column(name = "customer_id", nullable = false, updatable = false, length = 64)
    private String customerId;

    @Column(name = "program_id", nullable = false, updatable = false, length = 64)
    private String programId;

    @Column(name = "business_id", nullable = false, updatable = false, length = 64)
    private String businessId;

    @Column(name = "card_number", nullable = false, updatable = false, length = 32)
    private String cardNumber;

    @Column(nullable = false)
    private long balance;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CardTier tier;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CardStatus status;

    @Version
    @Column(nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "deactivated_at")
    private Instant deactivatedAt;

    public LoyaltyCard toDomain() {
        return new LoyaltyCard(
            id,
            enrollmentId,
            customerId,
            programId,
            businessId,
            cardNumber,
            balance,
            tier,
            status,
            version,
            createdAt,
            updatedAt,
            deactivatedAt
        );
    }

    /**
     * Copies the mutable fields from the domain object.
     * Identity, ownership and card number never change.
     */
    public void updateFromDomain(LoyaltyCard card) {
        if (!this.id.equals(card.getId())) {
            throw new IllegalArgumentException("Cannot update card " + id + " from card " + card.getId());
        }
        this.balance = card.getBalance();
        this.tier = card.getTier();
        this.status = card.getStatus();
        this.updatedAt = card.getUpdatedAt();
        this.deactivatedAt = card.getDeactivatedAt();
    }
}
