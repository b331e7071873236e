package com.flagship.loyalty_ledger.ledger;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PointTransactionRepository extends JpaRepository<PointTransactionEntity, UUID> {

    Optional<PointTransactionEntity> findByIdempotencyKey(String idempotencyKey);

    List<PointTransactionEntity> findByCardIdOrderBySequenceNumberDesc(UUID cardId, Pageable pageable);

    boolean existsByReversesTransactionId(UUID reversesTransactionId);
}
