package com.flagship.loyalty_ledger.notification;

import com.flagship.loyalty_ledger.observability.NotificationMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

/**
 * Fan-out rules: target matching, coalescing, stale and duplicate drops,
 * automatic unsubscribe of closed channels, and redelivery after a failure on
 * a channel that stays open.
 */
class NotificationDispatcherTest {

    private final NotificationMetrics metrics = mock(NotificationMetrics.class);
    private ThreadPoolTaskScheduler scheduler;
    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("dispatcher-test-");
        scheduler.initialize();
    }

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.shutdown();
        }
        scheduler.shutdown();
    }

    private NotificationDispatcher newDispatcher(long coalesceWindowMs) {
        return newDispatcher(coalesceWindowMs, 5);
    }

    private NotificationDispatcher newDispatcher(long coalesceWindowMs, int maxRedeliveryAttempts) {
        return new NotificationDispatcher(metrics, scheduler, coalesceWindowMs, maxRedeliveryAttempts);
    }

    private static NotificationEvent balanceEvent(String target, UUID cardId, long version) {
        return NotificationEvent.create(NotificationType.BALANCE_CHANGED, target, cardId,
            NotificationOutbox.dedupeKey(NotificationType.BALANCE_CHANGED, target, cardId, version),
            version, "{\"balance\":" + version * 10 + "}", Instant.now());
    }

    private static NotificationEvent enrollmentEvent(NotificationType type, String target, UUID enrollmentId) {
        return NotificationEvent.create(type, target, enrollmentId,
            NotificationOutbox.dedupeKey(type, target, enrollmentId, 0), 0, "{}", Instant.now());
    }

    @Test
    @DisplayName("Events reach only subscriptions for their target, plus wildcard subscriptions")
    void testTargetMatching() {
        dispatcher = newDispatcher(0);
        RecordingChannel customer = new RecordingChannel();
        RecordingChannel business = new RecordingChannel();
        RecordingChannel everything = new RecordingChannel();
        dispatcher.subscribe("cust-1", customer);
        dispatcher.subscribe("biz-1", business);
        dispatcher.subscribe(NotificationDispatcher.ALL_TARGETS, everything);

        UUID enrollmentId = UUID.randomUUID();
        dispatcher.publish(enrollmentEvent(NotificationType.ENROLLMENT_REQUESTED, "cust-1", enrollmentId));

        assertEquals(1, customer.received.size());
        assertEquals(0, business.received.size());
        assertEquals(1, everything.received.size());
    }

    @Test
    @DisplayName("A balance older than one already delivered is never delivered")
    void testStaleBalanceDropped() {
        dispatcher = newDispatcher(0);
        RecordingChannel channel = new RecordingChannel();
        dispatcher.subscribe("cust-1", channel);
        UUID cardId = UUID.randomUUID();

        dispatcher.publish(balanceEvent("cust-1", cardId, 3));
        dispatcher.publish(balanceEvent("cust-1", cardId, 2));
        dispatcher.publish(balanceEvent("cust-1", cardId, 4));

        assertEquals(List.of(3L, 4L), channel.sequences());
        verify(metrics).recordDropped("BALANCE_CHANGED", "stale");
    }

    @Test
    @DisplayName("A dedupe key already delivered is skipped")
    void testDuplicateDropped() {
        dispatcher = newDispatcher(0);
        RecordingChannel channel = new RecordingChannel();
        dispatcher.subscribe("biz-1", channel);
        NotificationEvent event = enrollmentEvent(NotificationType.ENROLLMENT_ACCEPTED, "biz-1", UUID.randomUUID());

        dispatcher.publish(event);
        dispatcher.publish(event);

        assertEquals(1, channel.received.size());
        verify(metrics).recordDropped("ENROLLMENT_ACCEPTED", "duplicate");
    }

    @Test
    @DisplayName("A burst of balance changes within the window collapses into the latest one")
    void testCoalescing() throws InterruptedException {
        dispatcher = newDispatcher(200);
        RecordingChannel channel = new RecordingChannel();
        dispatcher.subscribe("cust-1", channel);
        UUID cardId = UUID.randomUUID();

        dispatcher.publish(balanceEvent("cust-1", cardId, 1));
        dispatcher.publish(balanceEvent("cust-1", cardId, 3));
        dispatcher.publish(balanceEvent("cust-1", cardId, 2));

        assertTrue(channel.awaitDeliveries(1, 2, TimeUnit.SECONDS), "Coalesced event should be flushed");
        assertEquals(List.of(3L), channel.sequences());
        verify(metrics, org.mockito.Mockito.times(2)).recordCoalesced("BALANCE_CHANGED");
    }

    @Test
    @DisplayName("Different cards are never coalesced together")
    void testCoalescingIsPerSubject() {
        dispatcher = newDispatcher(10_000);
        RecordingChannel channel = new RecordingChannel();
        dispatcher.subscribe("cust-1", channel);

        dispatcher.publish(balanceEvent("cust-1", UUID.randomUUID(), 1));
        dispatcher.publish(balanceEvent("cust-1", UUID.randomUUID(), 1));
        dispatcher.flushPending();

        assertEquals(2, channel.received.size());
    }

    @Test
    @DisplayName("A channel that fails while closed is unsubscribed")
    void testClosedChannelUnsubscribed() {
        dispatcher = newDispatcher(0);
        RecordingChannel channel = new RecordingChannel();
        Subscription subscription = dispatcher.subscribe("cust-1", channel);
        channel.open = false;

        dispatcher.publish(enrollmentEvent(NotificationType.ENROLLMENT_REVOKED, "cust-1", UUID.randomUUID()));

        assertFalse(subscription.isActive());
        assertEquals(0, dispatcher.activeSubscriptionCount());
        verify(metrics).recordDeliveryFailed(eq("ENROLLMENT_REVOKED"), anyString());
    }

    @Test
    @DisplayName("Cancelled subscriptions receive nothing")
    void testCancel() {
        dispatcher = newDispatcher(0);
        RecordingChannel channel = new RecordingChannel();
        Subscription subscription = dispatcher.subscribe("cust-1", channel);
        subscription.cancel();
        subscription.cancel();

        dispatcher.publish(balanceEvent("cust-1", UUID.randomUUID(), 1));

        assertTrue(channel.received.isEmpty());
        assertThrows(IllegalArgumentException.class, () -> dispatcher.subscribe(" ", channel));
    }

    @Test
    @DisplayName("A failure on an open channel is reported to the caller and the retry reaches it once")
    void testTransientFailureReported() {
        dispatcher = newDispatcher(0);
        FlakyChannel flaky = new FlakyChannel(1);
        RecordingChannel healthy = new RecordingChannel();
        dispatcher.subscribe(NotificationDispatcher.ALL_TARGETS, flaky);
        dispatcher.subscribe("biz-1", healthy);
        NotificationEvent event = enrollmentEvent(NotificationType.ENROLLMENT_REQUESTED, "biz-1", UUID.randomUUID());

        NotificationDeliveryException failure = assertThrows(NotificationDeliveryException.class,
            () -> dispatcher.publish(event));
        assertEquals(event.getId(), failure.getEventId());
        assertEquals(1, failure.getFailedSubscriptions());
        assertInstanceOf(IOException.class, failure.getCause());
        assertTrue(flaky.received.isEmpty());
        assertEquals(1, healthy.received.size());

        assertDoesNotThrow(() -> dispatcher.publish(event));

        assertEquals(1, flaky.received.size());
        assertEquals(1, healthy.received.size());
        assertEquals(2, dispatcher.activeSubscriptionCount());
        verify(metrics).recordDropped("ENROLLMENT_REQUESTED", "duplicate");
    }

    @Test
    @DisplayName("A coalesced event that fails on an open channel is redelivered after a delay")
    void testCoalescedRedelivery() throws InterruptedException {
        dispatcher = newDispatcher(50);
        FlakyChannel flaky = new FlakyChannel(1);
        dispatcher.subscribe("cust-1", flaky);
        UUID cardId = UUID.randomUUID();

        dispatcher.publish(balanceEvent("cust-1", cardId, 7));

        assertTrue(flaky.awaitDeliveries(1, 3, TimeUnit.SECONDS), "Failed flush should be redelivered");
        assertEquals(List.of(7L), flaky.sequences());
        verify(metrics).recordRedelivery("BALANCE_CHANGED", "flaky");
        verify(metrics, never()).recordDropped("BALANCE_CHANGED", "undeliverable");
    }

    @Test
    @DisplayName("Redelivery of a coalesced event stops after the configured attempts")
    void testRedeliveryGivesUp() {
        dispatcher = newDispatcher(20, 2);
        FlakyChannel broken = new FlakyChannel(Integer.MAX_VALUE);
        Subscription subscription = dispatcher.subscribe("cust-1", broken);

        dispatcher.publish(balanceEvent("cust-1", UUID.randomUUID(), 1));

        verify(metrics, timeout(3000)).recordDropped("BALANCE_CHANGED", "undeliverable");
        verify(metrics, org.mockito.Mockito.times(2)).recordRedelivery("BALANCE_CHANGED", "flaky");
        assertTrue(broken.received.isEmpty());
        assertTrue(subscription.isActive(), "An open channel stays subscribed");
    }

    private static final class RecordingChannel implements DeliveryChannel {
        final List<NotificationEvent> received = new CopyOnWriteArrayList<>();
        final CountDownLatch firstDelivery = new CountDownLatch(1);
        volatile boolean open = true;

        @Override
        public void deliver(NotificationEvent event) {
            if (!open) {
                throw new IllegalStateException("channel closed");
            }
            received.add(event);
            firstDelivery.countDown();
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public String name() {
            return "recording";
        }

        List<Long> sequences() {
            return received.stream().map(NotificationEvent::getSequence).toList();
        }

        boolean awaitDeliveries(int count, long timeout, TimeUnit unit) throws InterruptedException {
            boolean arrived = firstDelivery.await(timeout, unit);
            return arrived && received.size() >= count;
        }
    }

    /**
     * Open channel whose first deliveries fail with an I/O error.
     */
    private static final class FlakyChannel implements DeliveryChannel {
        final List<NotificationEvent> received = new CopyOnWriteArrayList<>();
        final CountDownLatch firstDelivery = new CountDownLatch(1);
        private final AtomicInteger failuresLeft;

        FlakyChannel(int failures) {
            this.failuresLeft = new AtomicInteger(failures);
        }

        @Override
        public void deliver(NotificationEvent event) throws IOException {
            if (failuresLeft.getAndDecrement() > 0) {
                throw new IOException("connection reset");
            }
            received.add(event);
            firstDelivery.countDown();
        }

        @Override
        public boolean isOpen() {
            return true;
        }

        @Override
        public String name() {
            return "flaky";
        }

        List<Long> sequences() {
            return received.stream().map(NotificationEvent::getSequence).toList();
        }

        boolean awaitDeliveries(int count, long timeout, TimeUnit unit) throws InterruptedException {
            boolean arrived = firstDelivery.await(timeout, unit);
            return arrived && received.size() >= count;
        }
    }
}
