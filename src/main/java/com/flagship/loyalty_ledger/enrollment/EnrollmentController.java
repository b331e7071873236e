package com.flagship.loyalty_ledger.enrollment;

import com.flagship.loyalty_ledger.card.CardRegistry;
import com.flagship.loyalty_ledger.card.LoyaltyCard;
import com.flagship.loyalty_ledger.enrollment.dto.DecisionResponse;
import com.flagship.loyalty_ledger.enrollment.dto.EnrollmentResponse;
import com.flagship.loyalty_ledger.enrollment.dto.InvitationResponse;
import com.flagship.loyalty_ledger.enrollment.dto.InviteRequest;
import com.flagship.loyalty_ledger.enrollment.dto.RespondRequest;
import com.flagship.loyalty_ledger.enrollment.dto.RevokeRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class EnrollmentController {

    private final EnrollmentWorkflow workflow;
    private final CardRegistry cardRegistry;

    @PostMapping("/enrollments")
    public ResponseEntity<InvitationResponse> invite(@Valid @RequestBody InviteRequest request) {
        log.info("Received invitation: customer={}, program={}, business={}",
                request.getCustomerId(), request.getProgramId(), request.getBusinessId());

        Invitation invitation = workflow.invite(request.getCustomerId(), request.getProgramId(),
            request.getBusinessId());
        return ResponseEntity.status(HttpStatus.CREATED).body(InvitationResponse.from(invitation));
    }

    @PostMapping("/enrollments/{id}/respond")
    public ResponseEntity<DecisionResponse> respondToEnrollment(@PathVariable("id") UUID id,
                                                                @Valid @RequestBody RespondRequest request) {
        log.info("Received response for enrollment {}: accept={}", id, request.getAccept());
        return ResponseEntity.ok(DecisionResponse.from(workflow.respondToEnrollment(id, request.getAccept())));
    }

    @PostMapping("/approval-requests/{id}/respond")
    public ResponseEntity<DecisionResponse> respond(@PathVariable("id") UUID id,
                                                    @Valid @RequestBody RespondRequest request) {
        log.info("Received response for approval request {}: accept={}", id, request.getAccept());
        return ResponseEntity.ok(DecisionResponse.from(workflow.respond(id, request.getAccept())));
    }

    @PostMapping("/enrollments/{id}/revoke")
    public ResponseEntity<EnrollmentResponse> revoke(@PathVariable("id") UUID id,
                                                     @Valid @RequestBody(required = false) RevokeRequest request) {
        String reason = request != null ? request.getReason() : null;
        log.info("Received revocation for enrollment {}", id);
        Enrollment revoked = workflow.revoke(id, reason);
        return ResponseEntity.ok(EnrollmentResponse.from(revoked, cardIdFor(id)));
    }

    @GetMapping("/enrollments/{id}")
    public ResponseEntity<EnrollmentResponse> getEnrollment(@PathVariable("id") UUID id) {
        Enrollment enrollment = workflow.getEnrollment(id);
        return ResponseEntity.ok(EnrollmentResponse.from(enrollment, cardIdFor(id)));
    }

    private UUID cardIdFor(UUID enrollmentId) {
        return cardRegistry.findCardForEnrollment(enrollmentId).map(LoyaltyCard::getId).orElse(null);
    }
}
