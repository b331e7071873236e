package com.flagship.loyalty_ledger.card;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface LoyaltyCardRepository extends JpaRepository<LoyaltyCardEntity, UUID> {

    /**
     * Loads a card with SELECT ... FOR UPDATE. All balance writes for one card
     * serialize on this lock.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM LoyaltyCardEntity c WHERE c.id = :id")
    Optional<LoyaltyCardEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<LoyaltyCardEntity> findByEnrollmentId(UUID enrollmentId);

    Optional<LoyaltyCardEntity> findFirstByCustomerIdAndProgramIdAndStatus(
        String customerId, String programId, CardStatus status);

    List<LoyaltyCardEntity> findByCustomerIdOrderByCreatedAtAsc(String customerId);
}
