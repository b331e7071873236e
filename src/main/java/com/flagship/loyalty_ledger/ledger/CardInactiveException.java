package com.flagship.loyalty_ledger.ledger;

import com.flagship.loyalty_ledger.exception.ErrorCategory;
import com.flagship.loyalty_ledger.exception.LoyaltyException;

import java.util.UUID;

public class CardInactiveException extends LoyaltyException {

    public CardInactiveException(UUID cardId) {
        super("CARD_INACTIVE", ErrorCategory.CONFLICT, "Loyalty card " + cardId + " is inactive");
    }
}
