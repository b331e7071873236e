package com.flagship.loyalty_ledger.ledger;

/**
 * Where a point change came from. Each source fixes the sign its deltas may have.
 */
public enum TransactionSource {
    QR_SCAN(Sign.POSITIVE),
    MANUAL_AWARD(Sign.POSITIVE),
    PROMOTION(Sign.POSITIVE),
    REDEMPTION(Sign.NEGATIVE),
    ADJUSTMENT(Sign.ANY),
    REVERSAL(Sign.ANY);

    private enum Sign { POSITIVE, NEGATIVE, ANY }

    private final Sign sign;

    TransactionSource(Sign sign) {
        this.sign = sign;
    }

    public boolean permits(long delta) {
        return switch (sign) {
            case POSITIVE -> delta > 0;
            case NEGATIVE -> delta < 0;
            case ANY -> delta != 0;
        };
    }

    /**
     * REVERSAL rows are only written by {@link TransactionLedger#reverse}.
     */
    public boolean isCallerSelectable() {
        return this != REVERSAL;
    }
}
