package com.flagship.loyalty_ledger.card;

import com.flagship.loyalty_ledger.enrollment.EnrollmentDecision;
import com.flagship.loyalty_ledger.enrollment.Invitation;
import com.flagship.loyalty_ledger.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * One card per enrollment, no matter how many callers race to create it.
 */
class CardRegistryTest extends IntegrationTestSupport {

    @Autowired
    private CardRegistry cardRegistry;

    @Test
    @DisplayName("100 concurrent ensureCard calls for one enrollment yield exactly one card")
    void testEnsureCardUnderContention() throws InterruptedException {
        printTestHeader("ensureCard x100");
        Invitation invitation = enrollmentWorkflow.invite(uniqueId("cust"), uniqueId("prog"), uniqueId("biz"));
        EnrollmentDecision decision = enrollmentWorkflow.respond(invitation.getApprovalRequestId(), true);
        UUID enrollmentId = decision.getEnrollmentId();

        int callers = 100;
        ExecutorService executor = Executors.newFixedThreadPool(32);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(callers);
        Set<UUID> cardIds = ConcurrentHashMap.newKeySet();
        AtomicInteger failures = new AtomicInteger();

        for (int i = 0; i < callers; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    cardIds.add(cardRegistry.ensureCard(enrollmentId));
                } catch (Exception e) {
                    failures.incrementAndGet();
                    System.out.println("  Caller failed: " + e.getMessage());
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        Long rows = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM loyalty_cards WHERE enrollment_id = ?", Long.class, enrollmentId);
        printOutput("Distinct card ids", cardIds.size());
        printOutput("Card rows", rows);

        assertEquals(0, failures.get());
        assertEquals(1, cardIds.size());
        assertEquals(1L, rows);
        assertEquals(decision.getCardId(), cardIds.iterator().next(), "The card issued on acceptance is reused");
        printSuccess("Exactly one card");
    }

    @Test
    @DisplayName("New cards start at 0 points, STANDARD tier, with a GC- card number")
    void testNewCardDefaults() {
        String customerId = uniqueId("cust");
        String programId = uniqueId("prog");
        UUID cardId = activeCard(customerId, programId, uniqueId("biz"));

        LoyaltyCard card = cardRegistry.getCard(cardId);
        printOutput("Card", card);

        assertEquals(0, card.getBalance());
        assertEquals(CardTier.STANDARD, card.getTier());
        assertEquals(CardStatus.ACTIVE, card.getStatus());
        assertTrue(card.getCardNumber().matches("GC-\\d{6}-\\d{4}"), card.getCardNumber());
        assertEquals(cardId, cardRegistry.findActiveCard(customerId, programId).map(LoyaltyCard::getId).orElse(null));

        List<LoyaltyCard> cards = cardRegistry.findCardsForCustomer(customerId);
        assertEquals(1, cards.size());
    }

    @Test
    @DisplayName("No card is issued for an enrollment that is not ACTIVE")
    void testEnsureCardRequiresActiveEnrollment() {
        Invitation invitation = enrollmentWorkflow.invite(uniqueId("cust"), uniqueId("prog"), uniqueId("biz"));

        IllegalStateException e = assertThrows(IllegalStateException.class,
            () -> cardRegistry.ensureCard(invitation.getEnrollmentId()));
        printExpectedException("IllegalStateException", e.getMessage());

        assertThrows(IllegalStateException.class, () -> cardRegistry.ensureCard(UUID.randomUUID()));
        assertTrue(cardRegistry.findCardForEnrollment(invitation.getEnrollmentId()).isEmpty());
    }

    @Test
    @DisplayName("Unknown card ids are reported as not found")
    void testGetCardNotFound() {
        CardNotFoundException e = assertThrows(CardNotFoundException.class,
            () -> cardRegistry.getCard(UUID.randomUUID()));
        assertEquals("CARD_NOT_FOUND", e.getCode());
    }
}
