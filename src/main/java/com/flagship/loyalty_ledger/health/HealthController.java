package com.flagship.loyalty_ledger.health;

import com.flagship.loyalty_ledger.enrollment.ApprovalRequestRepository;
import com.flagship.loyalty_ledger.enrollment.ApprovalStatus;
import com.flagship.loyalty_ledger.notification.NotificationDispatcher;
import com.flagship.loyalty_ledger.observability.NotificationMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness check for load balancers and scanner apps, independent of the actuator.
 *
 * Only an unreachable database makes it 503. The ledger cannot accept a scan
 * without one; the notification and approval figures are informational.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final NotificationMetrics notificationMetrics;
    private final NotificationDispatcher dispatcher;
    private final ApprovalRequestRepository approvalRequestRepository;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Instant now = clock.instant();
        boolean databaseUp = databaseReachable();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", databaseUp ? "UP" : "DOWN");
        response.put("timestamp", now.toString());
        response.put("database", databaseUp ? "UP" : "DOWN");
        response.put("notification_backlog", notificationMetrics.getBacklogSize());
        response.put("live_subscriptions", dispatcher.activeSubscriptionCount());
        if (databaseUp) {
            response.put("overdue_approvals",
                approvalRequestRepository.countByStatusAndExpiresAtLessThanEqual(ApprovalStatus.PENDING, now));
        }

        return databaseUp ? ResponseEntity.ok(response) : ResponseEntity.status(503).body(response);
    }

    private boolean databaseReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database unreachable from health check: {}", e.getMessage());
            return false;
        }
    }
}
