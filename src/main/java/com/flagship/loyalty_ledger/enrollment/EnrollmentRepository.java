package com.flagship.loyalty_ledger.enrollment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EnrollmentRepository extends JpaRepository<EnrollmentEntity, UUID> {

    Optional<EnrollmentEntity> findFirstByCustomerIdAndProgramIdAndStatusIn(
        String customerId, String programId, Collection<EnrollmentStatus> statuses);

    Optional<EnrollmentEntity> findByOriginKey(String originKey);
}
