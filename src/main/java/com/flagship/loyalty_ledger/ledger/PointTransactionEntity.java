package com.flagship.loyalty_ledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for point_transactions.
 *
 * Insert-only: every column is non-updatable and a database trigger rejects
 * UPDATE and DELETE. Corrections are new REVERSAL rows.
 */
@Entity
@Immutable
@Table(
    name = "point_transactions",
    indexes = {
        @Index(name = "idx_point_transactions_card", columnList = "card_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PointTransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "card_id", nullable = false, updatable = false)
    private UUID cardId;

    @Column(nullable = false, updatable = false)
    private long delta;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 32)
    private TransactionSource source;

    @Column(name = "idempotency_key", nullable = false, updatable = false, unique = true)
    private String idempotencyKey;

    @Column(name = "balance_after", nullable = false, updatable = false)
    private long balanceAfter;

    @Column(name = "card_version", nullable = false, updatable = false)
    private long cardVersion;

    @Column(updatable = false, length = 500)
    private String description;

    @Column(name = "reverses_transaction_id", updatable = false)
    private UUID reversesTransactionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    static PointTransactionEntity fromDomain(PointTransaction transaction) {
        return new PointTransactionEntity(
            transaction.getId(),
            transaction.getCardId(),
            transaction.getDelta(),
            transaction.getSource(),
            transaction.getIdempotencyKey(),
            transaction.getBalanceAfter(),
            transaction.getCardVersion(),
            transaction.getDescription(),
            transaction.getReversesTransactionId(),
            transaction.getCreatedAt(),
            null  // sequenceNumber - assigned by database
        );
    }

    public PointTransaction toDomain() {
        return new PointTransaction(
            id,
            cardId,
            delta,
            source,
            idempotencyKey,
            balanceAfter,
            cardVersion,
            description,
            reversesTransactionId,
            createdAt,
            sequenceNumber
        );
    }
}
