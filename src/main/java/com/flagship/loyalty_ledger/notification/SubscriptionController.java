package com.flagship.loyalty_ledger.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Live notification stream for one customer or business.
 */
@RestController
@RequestMapping("/api/subscriptions")
@RequiredArgsConstructor
@Slf4j
public class SubscriptionController {

    private final NotificationDispatcher dispatcher;

    @Value("${notifications.sse.timeout-ms:1800000}")
    private long timeoutMs;

    @GetMapping(value = "/{targetId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter subscribe(@PathVariable("targetId") String targetId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        SseDeliveryChannel channel = new SseDeliveryChannel(emitter);
        Subscription subscription = dispatcher.subscribe(targetId, channel);
        channel.onClose(subscription::cancel);

        log.info("Opened notification stream {} for target {}", subscription.id(), targetId);
        return emitter;
    }
}
