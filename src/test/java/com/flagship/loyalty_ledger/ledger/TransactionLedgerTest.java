package com.flagship.loyalty_ledger.ledger;

import com.flagship.loyalty_ledger.card.CardNotFoundException;
import com.flagship.loyalty_ledger.card.CardRegistry;
import com.flagship.loyalty_ledger.card.CardTier;
import com.flagship.loyalty_ledger.card.LoyaltyCard;
import com.flagship.loyalty_ledger.support.IntegrationTestSupport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
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
 * Try to break the ledger: double crediting, negative balances, lost updates
 * and drift between the stored balance and the transaction log.
 */
class TransactionLedgerTest extends IntegrationTestSupport {

    @Autowired
    private TransactionLedger ledger;

    @Autowired
    private CardRegistry cardRegistry;

    private UUID cardId;

    @BeforeEach
    void setUp() {
        cardId = freshCard();
    }

    @Nested
    @DisplayName("Exactly-once application")
    class Idempotency {

        @Test
        @DisplayName("Awarding 10 points to a fresh card records one transaction and a balance of 10")
        void testAwardToFreshCard() {
            printTestHeader("Award to fresh card");
            printInput("Card", cardId);

            LedgerResult result = ledger.applyDelta(cardId, 10, TransactionSource.MANUAL_AWARD, "award:" + cardId);
            printOutput("Result", result);

            assertEquals(10, result.getNewBalance());
            assertFalse(result.isReplayed());
            assertNotNull(result.getTransactionId());
            assertEquals(10, storedBalance(cardId));
            assertEquals(1, transactionCount(cardId));
            printSuccess("Balance 10, one transaction");
        }

        @Test
        @DisplayName("Retrying with the same key after a timeout returns the original result")
        void testSequentialRetry() {
            printTestHeader("Sequential retry with same key");
            String key = "scan:" + UUID.randomUUID();

            LedgerResult first = ledger.applyDelta(cardId, 10, TransactionSource.QR_SCAN, key);
            LedgerResult second = ledger.applyDelta(cardId, 10, TransactionSource.QR_SCAN, key);
            LedgerResult third = ledger.applyDelta(cardId, 10, TransactionSource.QR_SCAN, key);
            printOutput("First", first);
            printOutput("Third", third);

            assertEquals(first.getTransactionId(), second.getTransactionId());
            assertEquals(first.getTransactionId(), third.getTransactionId());
            assertTrue(second.isReplayed());
            assertEquals(10, third.getNewBalance(), "Replay reports the balance recorded by the original");
            assertEquals(10, storedBalance(cardId), "Balance must be 10, never 20 or 30");
            assertEquals(1, transactionCount(cardId));
            printSuccess("No multiplication on retry");
        }

        @Test
        @DisplayName("Twenty concurrent submissions of one key apply the delta once")
        void testConcurrentRetries() throws InterruptedException {
            printTestHeader("Concurrent submissions of one key");
            String key = "redeem:" + UUID.randomUUID();
            int threads = 20;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);
            Set<UUID> transactionIds = ConcurrentHashMap.newKeySet();
            AtomicInteger failures = new AtomicInteger();

            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        transactionIds.add(ledger.applyDelta(cardId, 25, TransactionSource.PROMOTION, key)
                            .getTransactionId());
                    } catch (Exception e) {
                        failures.incrementAndGet();
                        System.out.println("  Thread failed: " + e.getMessage());
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(60, TimeUnit.SECONDS));
            executor.shutdown();

            printOutput("Distinct transaction ids", transactionIds.size());
            printOutput("Failures", failures.get());
            assertEquals(0, failures.get());
            assertEquals(1, transactionIds.size());
            assertEquals(25, storedBalance(cardId));
            assertEquals(1, transactionCount(cardId));
            printSuccess("Exactly one transaction under concurrent retries");
        }

        @Test
        @DisplayName("Two concurrent +5 awards with different keys give 10 and bump the version twice")
        void testConcurrentDistinctKeys() throws InterruptedException {
            printTestHeader("Concurrent distinct keys");
            long versionBefore = cardRegistry.getCard(cardId).getVersion();
            ExecutorService executor = Executors.newFixedThreadPool(2);
            CountDownLatch start = new CountDownLatch(1);
            List<String> keys = List.of("award:a:" + cardId, "award:b:" + cardId);
            Set<UUID> transactionIds = ConcurrentHashMap.newKeySet();

            for (String key : keys) {
                executor.submit(() -> {
                    start.await();
                    transactionIds.add(ledger.applyDelta(cardId, 5, TransactionSource.QR_SCAN, key).getTransactionId());
                    return null;
                });
            }
            start.countDown();
            executor.shutdown();
            assertTrue(executor.awaitTermination(30, TimeUnit.SECONDS));

            LoyaltyCard card = cardRegistry.getCard(cardId);
            printOutput("Balance", card.getBalance());
            printOutput("Version", versionBefore + " -> " + card.getVersion());
            assertEquals(10, card.getBalance());
            assertEquals(2, transactionIds.size());
            assertEquals(versionBefore + 2, card.getVersion());
            printSuccess("Both awards serialized on the card row");
        }
    }

    @Nested
    @DisplayName("Balance integrity")
    class Integrity {

        @Test
        @DisplayName("Redeeming 15 from a balance of 10 fails and changes nothing")
        void testInsufficientBalance() {
            printTestHeader("Insufficient balance");
            ledger.applyDelta(cardId, 10, TransactionSource.MANUAL_AWARD, "award:" + cardId);

            InsufficientBalanceException e = assertThrows(InsufficientBalanceException.class,
                () -> ledger.applyDelta(cardId, -15, TransactionSource.REDEMPTION, "redeem:" + cardId));
            printExpectedException("InsufficientBalanceException", e.getMessage());

            assertEquals("INSUFFICIENT_BALANCE", e.getCode());
            assertEquals(10, storedBalance(cardId));
            assertEquals(1, transactionCount(cardId), "A rejected redemption writes no transaction");
            assertTrue(ledger.findApplied("redeem:" + cardId).isEmpty(), "The key stays unused");
        }

        @Test
        @DisplayName("Concurrent redemptions can never overdraw the card")
        void testConcurrentRedemptionsNeverOverdraw() throws InterruptedException {
            printTestHeader("Concurrent redemptions");
            ledger.applyDelta(cardId, 100, TransactionSource.MANUAL_AWARD, "seed:" + cardId);
            int threads = 10;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger succeeded = new AtomicInteger();
            AtomicInteger rejected = new AtomicInteger();

            for (int i = 0; i < threads; i++) {
                String key = "redeem:" + i + ":" + cardId;
                executor.submit(() -> {
                    try {
                        start.await();
                        ledger.applyDelta(cardId, -30, TransactionSource.REDEMPTION, key);
                        succeeded.incrementAndGet();
                    } catch (InsufficientBalanceException e) {
                        rejected.incrementAndGet();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                });
            }
            start.countDown();
            executor.shutdown();
            assertTrue(executor.awaitTermination(60, TimeUnit.SECONDS));

            printOutput("Succeeded", succeeded.get());
            printOutput("Rejected", rejected.get());
            assertEquals(3, succeeded.get());
            assertEquals(7, rejected.get());
            assertEquals(10, storedBalance(cardId));
            assertTrue(ledger.reconcile(cardId));
        }

        @Test
        @DisplayName("Stored balance always equals the sum of the log")
        void testConservation() {
            printTestHeader("Conservation");
            ledger.applyDelta(cardId, 1500, TransactionSource.MANUAL_AWARD, "c1:" + cardId);
            ledger.applyDelta(cardId, -200, TransactionSource.REDEMPTION, "c2:" + cardId);
            ledger.applyDelta(cardId, -50, TransactionSource.ADJUSTMENT, "c3:" + cardId);
            ledger.applyDelta(cardId, 75, TransactionSource.ADJUSTMENT, "c4:" + cardId);

            LedgerSummary summary = ledger.summarize(cardId);
            printOutput("Summary", summary);

            assertEquals(1325, summary.getBalance());
            assertEquals(1575, summary.getTotalEarned());
            assertEquals(200, summary.getTotalRedeemed());
            assertEquals(50, summary.getTotalDeducted());
            assertEquals(4, summary.getTransactionCount());
            assertTrue(summary.isConsistent());
            assertTrue(ledger.reconcile(cardId));

            Long logTotal = jdbcTemplate.queryForObject(
                "SELECT SUM(delta) FROM point_transactions WHERE card_id = ?", Long.class, cardId);
            assertEquals(storedBalance(cardId), logTotal);
            assertEquals(CardTier.SILVER, cardRegistry.getCard(cardId).getTier());
        }

        @Test
        @DisplayName("Transactions cannot be updated or deleted")
        void testAppendOnly() {
            LedgerResult result = ledger.applyDelta(cardId, 10, TransactionSource.MANUAL_AWARD, "ao:" + cardId);

            assertThrows(Exception.class, () -> jdbcTemplate.update(
                "UPDATE point_transactions SET delta = 1000 WHERE id = ?", result.getTransactionId()));
            assertThrows(Exception.class, () -> jdbcTemplate.update(
                "DELETE FROM point_transactions WHERE id = ?", result.getTransactionId()));
            assertEquals(10, storedBalance(cardId));
        }
    }

    @Nested
    @DisplayName("Reversals")
    class Reversals {

        @Test
        @DisplayName("A reversal offsets the original once, however often it is requested")
        void testReversal() {
            printTestHeader("Reversal");
            LedgerResult award = ledger.applyDelta(cardId, 40, TransactionSource.QR_SCAN, "rv:" + cardId);

            LedgerResult reversal = ledger.reverse(award.getTransactionId(), "scanned by mistake");
            LedgerResult again = ledger.reverse(award.getTransactionId(), null);
            printOutput("Reversal", reversal);

            assertEquals(0, reversal.getNewBalance());
            assertTrue(again.isReplayed());
            assertEquals(reversal.getTransactionId(), again.getTransactionId());

            PointTransaction recorded = ledger.getTransaction(reversal.getTransactionId());
            assertEquals(TransactionSource.REVERSAL, recorded.getSource());
            assertEquals(-40, recorded.getDelta());
            assertEquals(award.getTransactionId(), recorded.getReversesTransactionId());
            assertEquals(2, transactionCount(cardId));

            assertThrows(InvalidLedgerRequestException.class,
                () -> ledger.reverse(reversal.getTransactionId(), "reverse the reversal"));
        }

        @Test
        @DisplayName("Reversing an award that was already spent fails with insufficient balance")
        void testReversalOfSpentPoints() {
            LedgerResult award = ledger.applyDelta(cardId, 40, TransactionSource.QR_SCAN, "rs:" + cardId);
            ledger.applyDelta(cardId, -30, TransactionSource.REDEMPTION, "rs-redeem:" + cardId);

            assertThrows(InsufficientBalanceException.class, () -> ledger.reverse(award.getTransactionId(), null));
            assertEquals(10, storedBalance(cardId));
        }
    }

    @Nested
    @DisplayName("Input validation")
    class Validation {

        @Test
        @DisplayName("Malformed requests are rejected before touching the card")
        void testInvalidRequests() {
            assertThrows(InvalidLedgerRequestException.class,
                () -> ledger.applyDelta(cardId, 0, TransactionSource.MANUAL_AWARD, "z:" + cardId));
            assertThrows(InvalidLedgerRequestException.class,
                () -> ledger.applyDelta(cardId, -5, TransactionSource.QR_SCAN, "neg:" + cardId));
            assertThrows(InvalidLedgerRequestException.class,
                () -> ledger.applyDelta(cardId, 5, TransactionSource.REDEMPTION, "pos:" + cardId));
            assertThrows(InvalidLedgerRequestException.class,
                () -> ledger.applyDelta(cardId, 5, TransactionSource.MANUAL_AWARD, " "));
            assertThrows(InvalidLedgerRequestException.class,
                () -> ledger.applyDelta(cardId, 5, TransactionSource.REVERSAL, "rev:" + cardId));
            assertThrows(InvalidLedgerRequestException.class,
                () -> ledger.applyDelta(cardId, 10_001, TransactionSource.MANUAL_AWARD, "big:" + cardId));
            assertEquals(0, transactionCount(cardId));
        }

        @Test
        @DisplayName("Unknown cards and transactions are reported as not found")
        void testNotFound() {
            assertThrows(CardNotFoundException.class,
                () -> ledger.applyDelta(UUID.randomUUID(), 5, TransactionSource.MANUAL_AWARD, "nf:" + UUID.randomUUID()));
            assertThrows(TransactionNotFoundException.class, () -> ledger.getTransaction(UUID.randomUUID()));
        }

        @Test
        @DisplayName("History is newest first and bounded")
        void testHistory() {
            ledger.applyDelta(cardId, 1, TransactionSource.MANUAL_AWARD, "h1:" + cardId);
            ledger.applyDelta(cardId, 2, TransactionSource.MANUAL_AWARD, "h2:" + cardId);
            ledger.applyDelta(cardId, 3, TransactionSource.MANUAL_AWARD, "h3:" + cardId);

            List<PointTransaction> history = ledger.getHistory(cardId, 2);
            assertEquals(2, history.size());
            assertEquals(3, history.get(0).getDelta());
            assertEquals(6, history.get(0).getBalanceAfter());
            assertEquals(2, history.get(1).getDelta());
            assertThrows(InvalidLedgerRequestException.class, () -> ledger.getHistory(cardId, 0));
        }
    }
}
