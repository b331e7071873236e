package com.flagship.loyalty_ledger.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.loyalty_ledger.card.CardRegistry;
import com.flagship.loyalty_ledger.card.LoyaltyCard;
import com.flagship.loyalty_ledger.ledger.LedgerResult;
import com.flagship.loyalty_ledger.ledger.TransactionLedger;
import com.flagship.loyalty_ledger.ledger.TransactionSource;
import com.flagship.loyalty_ledger.observability.NotificationMetrics;
import com.flagship.loyalty_ledger.support.IntegrationTestSupport;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.IllegalTransactionStateException;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Write path to outbox to relay to dispatcher.
 *
 * Verifies that:
 * - every newly applied transaction writes BALANCE_CHANGED for customer and business
 * - idempotent replays and rejected writes write nothing
 * - the relay hands outbox rows to subscribers and marks them dispatched
 * - a row a subscriber failed to take stays undispatched until a later pass delivers it
 */
class NotificationOutboxTest extends IntegrationTestSupport {

    @Autowired
    private TransactionLedger ledger;

    @Autowired
    private CardRegistry cardRegistry;

    @Autowired
    private NotificationOutbox outbox;

    @Autowired
    private NotificationDispatcher dispatcher;

    @Autowired
    private NotificationMetrics notificationMetrics;

    @Autowired
    private ObjectMapper objectMapper;

    private NotificationRelay relay() {
        NotificationRelay relay = new NotificationRelay(outbox, dispatcher, notificationMetrics);
        ReflectionTestUtils.setField(relay, "batchSize", 1000);
        ReflectionTestUtils.setField(relay, "maxRetries", 5);
        return relay;
    }

    private List<NotificationEvent> balanceEvents(UUID cardId) {
        return outbox.findForSubject(cardId).stream()
            .filter(event -> event.getType() == NotificationType.BALANCE_CHANGED)
            .toList();
    }

    @Test
    @DisplayName("A new transaction emits one BALANCE_CHANGED per audience; a replay emits none")
    void testBalanceEventsOnlyForNewWrites() throws Exception {
        printTestHeader("Outbox on write and replay");
        UUID cardId = freshCard();
        LoyaltyCard card = cardRegistry.getCard(cardId);
        String key = "outbox:" + cardId;

        LedgerResult result = ledger.applyDelta(cardId, 10, TransactionSource.QR_SCAN, key);
        ledger.applyDelta(cardId, 10, TransactionSource.QR_SCAN, key);

        List<NotificationEvent> events = balanceEvents(cardId);
        printOutput("Events", events.size());

        assertEquals(2, events.size(), "One for the customer, one for the business, none for the replay");
        assertEquals(Map.of(card.getCustomerId(), result.getCardVersion(), card.getBusinessId(), result.getCardVersion()),
            Map.of(events.get(0).getTargetId(), events.get(0).getSequence(),
                events.get(1).getTargetId(), events.get(1).getSequence()));
        JsonNode payload = objectMapper.readTree(events.get(0).getPayload());
        assertEquals(10, payload.get("balance").asLong());
        assertEquals(result.getTransactionId().toString(), payload.get("transaction_id").asText());
    }

    @Test
    @DisplayName("A rejected write leaves no event behind")
    void testNoEventOnRejection() {
        UUID cardId = freshCard();

        assertThrows(RuntimeException.class,
            () -> ledger.applyDelta(cardId, -5, TransactionSource.REDEMPTION, "reject:" + cardId));

        assertTrue(balanceEvents(cardId).isEmpty());
    }

    @Test
    @DisplayName("Crossing a tier threshold emits CARD_TIER_CHANGED")
    void testTierChangeEvent() {
        UUID cardId = freshCard();

        ledger.applyDelta(cardId, 1000, TransactionSource.MANUAL_AWARD, "tier:" + cardId);

        long tierEvents = outbox.findForSubject(cardId).stream()
            .filter(event -> event.getType() == NotificationType.CARD_TIER_CHANGED)
            .count();
        assertEquals(2, tierEvents);
    }

    @Test
    @DisplayName("The relay delivers outbox rows to subscribers in order and marks them dispatched")
    void testRelayDelivers() {
        printTestHeader("Relay delivery");
        UUID cardId = freshCard();
        LoyaltyCard card = cardRegistry.getCard(cardId);
        List<NotificationEvent> received = new CopyOnWriteArrayList<>();
        Subscription subscription = dispatcher.subscribe(card.getCustomerId(), new DeliveryChannel() {
            @Override
            public void deliver(NotificationEvent event) {
                received.add(event);
            }

            @Override
            public boolean isOpen() {
                return true;
            }

            @Override
            public String name() {
                return "test";
            }
        });

        try {
            ledger.applyDelta(cardId, 5, TransactionSource.QR_SCAN, "relay-1:" + cardId);
            ledger.applyDelta(cardId, 7, TransactionSource.QR_SCAN, "relay-2:" + cardId);

            relay().relayPendingEvents();

            List<NotificationEvent> balances = received.stream()
                .filter(event -> event.getType() == NotificationType.BALANCE_CHANGED)
                .toList();
            printOutput("Delivered", balances.size());
            assertEquals(2, balances.size());
            assertTrue(balances.get(0).getSequence() < balances.get(1).getSequence());
            assertTrue(balances.stream().allMatch(event -> card.getCustomerId().equals(event.getTargetId())));
            assertTrue(balanceEvents(cardId).stream().allMatch(NotificationEvent::isDispatched));
            printSuccess("Delivered in ledger order");
        } finally {
            subscription.cancel();
        }
    }

    @Test
    @DisplayName("A row a subscriber failed to take is retried on the next pass, not marked dispatched")
    void testRelayRetriesFailedDelivery() {
        printTestHeader("Relay retry after transient delivery failure");
        UUID cardId = freshCard();
        LoyaltyCard card = cardRegistry.getCard(cardId);
        List<NotificationEvent> received = new CopyOnWriteArrayList<>();
        AtomicInteger failuresLeft = new AtomicInteger(1);
        Subscription subscription = dispatcher.subscribe(card.getCustomerId(), new DeliveryChannel() {
            @Override
            public void deliver(NotificationEvent event) throws Exception {
                if (failuresLeft.getAndDecrement() > 0) {
                    throw new java.io.IOException("stream stalled");
                }
                received.add(event);
            }

            @Override
            public boolean isOpen() {
                return true;
            }

            @Override
            public String name() {
                return "test";
            }
        });

        try {
            ledger.applyDelta(cardId, 5, TransactionSource.QR_SCAN, "retry:" + cardId);
            List<NotificationEvent> forCustomer = outbox.findForTarget(card.getCustomerId(), 0, 100);

            relay().relayPendingEvents();

            List<NotificationEvent> afterFirstPass = outbox.findForTarget(card.getCustomerId(), 0, 100);
            List<NotificationEvent> undispatched = afterFirstPass.stream()
                .filter(event -> !event.isDispatched())
                .toList();
            printOutput("Undispatched after first pass", undispatched.size());
            assertEquals(1, undispatched.size());
            assertEquals(1, undispatched.get(0).getRetryCount());
            assertEquals(forCustomer.size() - 1, received.size());

            relay().relayPendingEvents();

            assertTrue(outbox.findForTarget(card.getCustomerId(), 0, 100).stream()
                .allMatch(NotificationEvent::isDispatched));
            assertEquals(forCustomer.size(), received.size());
            assertEquals(forCustomer.size(),
                received.stream().map(NotificationEvent::getDedupeKey).distinct().count());
            printSuccess("Every event reached the subscriber exactly once");
        } finally {
            subscription.cancel();
        }
    }

    @Test
    @DisplayName("Appending outside a transaction is refused")
    void testAppendRequiresTransaction() {
        assertThrows(IllegalTransactionStateException.class,
            () -> outbox.append(NotificationType.BALANCE_CHANGED, "cust", UUID.randomUUID(), 1, Map.of()));
    }

    @Test
    @DisplayName("Polling reads a target's events after a cursor")
    void testPollingCursor() {
        UUID cardId = freshCard();
        LoyaltyCard card = cardRegistry.getCard(cardId);
        ledger.applyDelta(cardId, 1, TransactionSource.QR_SCAN, "poll-1:" + cardId);
        ledger.applyDelta(cardId, 2, TransactionSource.QR_SCAN, "poll-2:" + cardId);

        // ENROLLMENT_ACCEPTED plus two balance changes
        List<NotificationEvent> all = outbox.findForTarget(card.getBusinessId(), 0, 100);
        assertEquals(3, all.size());
        assertEquals(NotificationType.ENROLLMENT_ACCEPTED, all.get(0).getType());

        List<NotificationEvent> after = outbox.findForTarget(card.getBusinessId(), all.get(1).getOutboxSequence(), 100);
        assertEquals(1, after.size());
        assertEquals(all.get(2).getId(), after.get(0).getId());
    }
}
