package com.flagship.loyalty_ledger.enrollment;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Background sweep that expires approval requests nobody answered in time.
 *
 * Each request is expired in its own transaction, so one failure does not
 * hold back the rest of the batch.
 */
@Component
@ConditionalOnProperty(name = "loyalty.enrollment.expiry-sweep.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ApprovalExpirySweeper {

    private final EnrollmentWorkflow workflow;

    @Value("${loyalty.enrollment.expiry-sweep-batch-size:200}")
    private int batchSize;

    @Scheduled(fixedDelayString = "${loyalty.enrollment.expiry-sweep-interval-ms:60000}")
    public void sweepExpiredRequests() {
        try {
            int expired = sweep();
            if (expired > 0) {
                log.info("Expired {} approval requests", expired);
            }
        } catch (Exception e) {
            log.error("Error in approval expiry sweep", e);
        }
    }

    /**
     * Runs one pass.
     *
     * @return number of requests expired by this pass
     */
    public int sweep() {
        List<UUID> candidates = workflow.findExpiredRequestIds(batchSize);
        int expired = 0;
        for (UUID requestId : candidates) {
            try {
                if (workflow.expire(requestId)) {
                    expired++;
                }
            } catch (Exception e) {
                log.error("Failed to expire approval request {}: {}", requestId, e.getMessage());
            }
        }
        return expired;
    }
}
