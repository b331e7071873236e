package com.flagship.loyalty_ledger.ledger;

import com.flagship.loyalty_ledger.ledger.dto.ApplyDeltaRequest;
import com.flagship.loyalty_ledger.ledger.dto.LedgerResultResponse;
import com.flagship.loyalty_ledger.ledger.dto.ReversalRequest;
import com.flagship.loyalty_ledger.ledger.dto.TransactionResponse;
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

/**
 * REST surface of the ledger.
 *
 * POST responses are 201 when a new transaction was written and 200 when the
 * idempotency key had already been applied; the body is identical either way.
 */
@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private final TransactionLedger ledger;

    @PostMapping
    public ResponseEntity<LedgerResultResponse> applyDelta(@Valid @RequestBody ApplyDeltaRequest request) {
        log.info("Received ledger request: card={}, delta={}, source={}, idempotencyKey={}",
                request.getCardId(), request.getDelta(), request.getSource(), request.getIdempotencyKey());

        LedgerResult result = ledger.applyDelta(request.getCardId(), request.getDelta(),
                request.getSource(), request.getIdempotencyKey(), request.getDescription());

        return respond(result);
    }

    @PostMapping("/{id}/reversal")
    public ResponseEntity<LedgerResultResponse> reverse(@PathVariable("id") UUID id,
                                                        @Valid @RequestBody(required = false) ReversalRequest request) {
        String reason = request != null ? request.getReason() : null;
        log.info("Received reversal request for transaction {}", id);
        return respond(ledger.reverse(id, reason));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TransactionResponse> getTransaction(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(TransactionResponse.from(ledger.getTransaction(id)));
    }

    private ResponseEntity<LedgerResultResponse> respond(LedgerResult result) {
        HttpStatus status = result.isReplayed() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(LedgerResultResponse.from(result));
    }
}
