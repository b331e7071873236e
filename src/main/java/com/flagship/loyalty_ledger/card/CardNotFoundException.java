package com.flagship.loyalty_ledger.card;

import com.flagship.loyalty_ledger.exception.ErrorCategory;
import com.flagship.loyalty_ledger.exception.LoyaltyException;
import org.springframework.http.HttpStatus;

import java.util.UUID;

public class CardNotFoundException extends LoyaltyException {

    public CardNotFoundException(UUID cardId) {
        super("CARD_NOT_FOUND", ErrorCategory.INTEGRITY, "Loyalty card not found: " + cardId);
    }

    @Override
    public HttpStatus getHttpStatus() {
        return HttpStatus.NOT_FOUND;
    }
}
