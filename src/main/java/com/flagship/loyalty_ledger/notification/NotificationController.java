package com.flagship.loyalty_ledger.notification;

import com.flagship.loyalty_ledger.notification.dto.NotificationResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Polling transport over the notification outbox.
 *
 * Clients pass the largest {@code cursor} they have seen as
 * {@code after_sequence} and get everything newer, in write order.
 */
@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private static final int MAX_LIMIT = 500;

    private final NotificationOutbox outbox;

    @GetMapping
    public ResponseEntity<List<NotificationResponse>> poll(
            @RequestParam("target_id") String targetId,
            @RequestParam(value = "after_sequence", defaultValue = "0") long afterSequence,
            @RequestParam(value = "limit", defaultValue = "100") int limit) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        List<NotificationResponse> events = outbox.findForTarget(targetId, afterSequence, limit)
                .stream()
                .map(NotificationResponse::from)
                .toList();
        return ResponseEntity.ok(events);
    }
}
