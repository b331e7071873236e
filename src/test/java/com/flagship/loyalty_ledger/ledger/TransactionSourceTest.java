package com.flagship.loyalty_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TransactionSourceTest {

    @Test
    @DisplayName("Award sources only take positive deltas, redemptions only negative")
    void testSignRules() {
        assertTrue(TransactionSource.QR_SCAN.permits(10));
        assertFalse(TransactionSource.QR_SCAN.permits(-10));
        assertTrue(TransactionSource.MANUAL_AWARD.permits(1));
        assertFalse(TransactionSource.PROMOTION.permits(-1));

        assertTrue(TransactionSource.REDEMPTION.permits(-10));
        assertFalse(TransactionSource.REDEMPTION.permits(10));

        assertTrue(TransactionSource.ADJUSTMENT.permits(5));
        assertTrue(TransactionSource.ADJUSTMENT.permits(-5));
        assertFalse(TransactionSource.ADJUSTMENT.permits(0));
    }

    @Test
    @DisplayName("Reversals cannot be requested directly")
    void testReversalNotSelectable() {
        assertFalse(TransactionSource.REVERSAL.isCallerSelectable());
        for (TransactionSource source : TransactionSource.values()) {
            if (source != TransactionSource.REVERSAL) {
                assertTrue(source.isCallerSelectable(), source + " should be selectable");
            }
        }
    }
}
