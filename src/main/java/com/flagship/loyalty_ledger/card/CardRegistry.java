package com.flagship.loyalty_ledger.card;

import com.flagship.loyalty_ledger.observability.CorrelationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.security.SecureRandom;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns the lifecycle of loyalty cards.
 *
 * Exactly one card exists per enrollment. Issuance uses a database-level
 * INSERT ... ON CONFLICT DO NOTHING followed by a read, so any number of
 * concurrent callers for the same enrollment observe the same card id.
 *
 * Balances are never written here; that is the ledger's job.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CardRegistry {

    private static final int CARD_NUMBER_ATTEMPTS = 5;

    private static final String ISSUE_CARD_SQL = """
        INSERT INTO loyalty_cards (id, enrollment_id, customer_id, program_id, business_id,
                                   card_number, balance, tier, status, version, created_at, updated_at)
        SELECT ?, e.id, e.customer_id, e.program_id, e.business_id,
               ?, 0, 'STANDARD', 'ACTIVE', 0, ?, ?
        FROM enrollments e
        WHERE e.id = ? AND e.status = 'ACTIVE'
        ON CONFLICT DO NOTHING
        """;

    private final JdbcTemplate jdbcTemplate;
    private final LoyaltyCardRepository repository;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    /**
     * Returns the card for an enrollment, creating it on first call.
     *
     * The enrollment must be ACTIVE (visible in the caller's transaction).
     * New cards start at balance 0, tier STANDARD.
     *
     * @param enrollmentId Enrollment to issue a card for
     * @return Id of the one card belonging to the enrollment
     * @throws IllegalStateException if the enrollment does not exist or is not ACTIVE
     */
    @Transactional
    public UUID ensureCard(UUID enrollmentId) {
        for (int attempt = 1; attempt <= CARD_NUMBER_ATTEMPTS; attempt++) {
            Optional<UUID> existing = findCardIdForEnrollment(enrollmentId);
            if (existing.isPresent()) {
                return existing.get();
            }

            Timestamp now = Timestamp.from(clock.instant());
            UUID cardId = UUID.randomUUID();
            int inserted = jdbcTemplate.update(ISSUE_CARD_SQL,
                cardId, generateCardNumber(), now, now, enrollmentId);

            if (inserted == 1) {
                log.info("Issued loyalty card {} for enrollment {}", cardId, enrollmentId);
                return cardId;
            }

            // Nothing inserted: either another caller won the race, the card number
            // collided, or the enrollment is not eligible.
            existing = findCardIdForEnrollment(enrollmentId);
            if (existing.isPresent()) {
                log.debug("Card for enrollment {} was issued concurrently", enrollmentId);
                return existing.get();
            }
            if (!isEnrollmentActive(enrollmentId)) {
                throw new IllegalStateException(
                    "Cannot issue card: enrollment " + enrollmentId + " is missing or not ACTIVE");
            }
            log.debug("Card number collision for enrollment {}, attempt {}", enrollmentId, attempt);
        }
        throw new IllegalStateException("Could not allocate a unique card number for enrollment " + enrollmentId);
    }

    @Transactional(readOnly = true)
    public LoyaltyCard getCard(UUID cardId) {
        return repository.findById(cardId)
            .map(LoyaltyCardEntity::toDomain)
            .orElseThrow(() -> new CardNotFoundException(cardId));
    }

    @Transactional(readOnly = true)
    public Optional<LoyaltyCard> findCardForEnrollment(UUID enrollmentId) {
        return repository.findByEnrollmentId(enrollmentId).map(LoyaltyCardEntity::toDomain);
    }

    /**
     * Finds the active card a customer holds in a program, if any.
     * Used when a scanned customer QR has to be resolved to a card.
     */
    @Transactional(readOnly = true)
    public Optional<LoyaltyCard> findActiveCard(String customerId, String programId) {
        return repository.findFirstByCustomerIdAndProgramIdAndStatus(customerId, programId, CardStatus.ACTIVE)
            .map(LoyaltyCardEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<LoyaltyCard> findCardsForCustomer(String customerId) {
        return repository.findByCustomerIdOrderByCreatedAtAsc(customerId)
            .stream()
            .map(LoyaltyCardEntity::toDomain)
            .toList();
    }

    /**
     * Marks the enrollment's card INACTIVE. The card and its history are kept.
     *
     * @return The deactivated card, or empty if the enrollment never had one
     */
    @Transactional
    public Optional<LoyaltyCard> deactivate(UUID enrollmentId) {
        return repository.findByEnrollmentId(enrollmentId).map(entity -> {
            try (MDC.MDCCloseable ignored = CorrelationContext.forCard(entity.getId())) {
                LoyaltyCard deactivated = entity.toDomain().deactivate(clock.instant());
                entity.updateFromDomain(deactivated);
                repository.save(entity);
                log.info("Deactivated card {} for enrollment {}", entity.getId(), enrollmentId);
                return entity.toDomain();
            }
        });
    }

    private Optional<UUID> findCardIdForEnrollment(UUID enrollmentId) {
        List<UUID> ids = jdbcTemplate.queryForList(
            "SELECT id FROM loyalty_cards WHERE enrollment_id = ?", UUID.class, enrollmentId);
        return ids.stream().findFirst();
    }

    private boolean isEnrollmentActive(UUID enrollmentId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM enrollments WHERE id = ? AND status = 'ACTIVE'",
            Integer.class, enrollmentId);
        return count != null && count > 0;
    }

    /**
     * Card numbers look like GC-123456-0042: the last six digits of the
     * issue timestamp and four random digits.
     */
    String generateCardNumber() {
        String millis = Long.toString(Instant.now(clock).toEpochMilli());
        String timePart = millis.substring(Math.max(0, millis.length() - 6));
        return String.format("GC-%s-%04d", timePart, random.nextInt(10_000));
    }
}
