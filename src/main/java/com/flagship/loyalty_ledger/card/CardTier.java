package com.flagship.loyalty_ledger.card;

/**
 * Card tiers, derived from the current balance after every ledger write.
 * Tiers go down as well as up when points are redeemed or reversed.
 */
public enum CardTier {
    STANDARD(0),
    SILVER(1000),
    GOLD(2500),
    PLATINUM(5000);

    private final long minimumBalance;

    CardTier(long minimumBalance) {
        this.minimumBalance = minimumBalance;
    }

    public long getMinimumBalance() {
        return minimumBalance;
    }

    public static CardTier forBalance(long balance) {
        CardTier result = STANDARD;
        for (CardTier tier : values()) {
            if (balance >= tier.minimumBalance) {
                result = tier;
            }
        }
        return result;
    }
}
