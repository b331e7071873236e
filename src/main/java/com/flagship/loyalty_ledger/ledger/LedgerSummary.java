package com.flagship.loyalty_ledger.ledger;

import lombok.Value;

import java.util.UUID;

/**
 * Read-side totals for a card. Only {@code balance} is stored; everything else
 * is aggregated from the transaction log on demand.
 */
@Value
public class LedgerSummary {
    UUID cardId;
    long balance;
    long totalEarned;
    long totalRedeemed;
    long totalDeducted;
    long transactionCount;

    /**
     * Conservation check: the stored balance equals the sum of all deltas.
     */
    public boolean isConsistent() {
        return balance == totalEarned - totalRedeemed - totalDeducted;
    }
}
