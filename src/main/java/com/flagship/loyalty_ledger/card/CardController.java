package com.flagship.loyalty_ledger.card;

import com.flagship.loyalty_ledger.card.dto.CardResponse;
import com.flagship.loyalty_ledger.card.dto.CardSummaryResponse;
import com.flagship.loyalty_ledger.card.dto.QrPayloadResponse;
import com.flagship.loyalty_ledger.ledger.TransactionLedger;
import com.flagship.loyalty_ledger.ledger.dto.TransactionResponse;
import com.flagship.loyalty_ledger.qr.QrCodeIssuer;
import com.flagship.loyalty_ledger.qr.QrType;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Read side for cards. Balances change only through /api/transactions.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CardController {

    private final CardRegistry cardRegistry;
    private final TransactionLedger ledger;
    private final QrCodeIssuer qrCodeIssuer;

    @GetMapping("/cards/{id}")
    public ResponseEntity<CardResponse> getCard(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(CardResponse.from(cardRegistry.getCard(id)));
    }

    @GetMapping("/cards/{id}/transactions")
    public ResponseEntity<List<TransactionResponse>> getHistory(
            @PathVariable("id") UUID id,
            @RequestParam(value = "limit", defaultValue = "50") int limit) {
        List<TransactionResponse> history = ledger.getHistory(id, limit).stream()
            .map(TransactionResponse::from)
            .toList();
        return ResponseEntity.ok(history);
    }

    @GetMapping("/cards/{id}/summary")
    public ResponseEntity<CardSummaryResponse> getSummary(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(CardSummaryResponse.from(ledger.summarize(id)));
    }

    /**
     * Signed LOYALTY_CARD payload, scannable only by the card's business.
     */
    @GetMapping("/cards/{id}/qr-payload")
    public ResponseEntity<QrPayloadResponse> getQrPayload(@PathVariable("id") UUID id) {
        LoyaltyCard card = cardRegistry.getCard(id);
        if (!card.isActive()) {
            throw new IllegalStateException("Card " + id + " is " + card.getStatus());
        }
        return ResponseEntity.ok(QrPayloadResponse.from(
            qrCodeIssuer.issue(QrType.LOYALTY_CARD, card.getId().toString(), card.getBusinessId())));
    }

    @GetMapping("/customers/{customerId}/cards")
    public ResponseEntity<List<CardResponse>> getCustomerCards(@PathVariable("customerId") String customerId) {
        List<CardResponse> cards = cardRegistry.findCardsForCustomer(customerId).stream()
            .map(CardResponse::from)
            .toList();
        return ResponseEntity.ok(cards);
    }

    /**
     * Signed CUSTOMER payload for one business. Scanning it awards points, or
     * invites the customer if they are not enrolled yet.
     */
    @GetMapping("/customers/{customerId}/qr-payload")
    public ResponseEntity<QrPayloadResponse> getCustomerQrPayload(
            @PathVariable("customerId") String customerId,
            @RequestParam("business_id") String businessId) {
        return ResponseEntity.ok(QrPayloadResponse.from(
            qrCodeIssuer.issue(QrType.CUSTOMER, customerId, businessId)));
    }
}
