package com.flagship.loyalty_ledger.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * A validated request to change a card balance.
 */
@Value
public class LedgerWrite {
    UUID cardId;
    long delta;
    TransactionSource source;
    String idempotencyKey;
    String description;
    UUID reversesTransactionId;
}
