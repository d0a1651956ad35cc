package com.example.fulfillment.support.fakes;

import com.example.fulfillment.domain.model.PointsTransaction;
import com.example.fulfillment.domain.model.TransactionType;

/**
 * Ledger rows that tests seed directly.
 */
public final class LedgerFixtures {

    private LedgerFixtures() {
    }

    /**
     * Unlinked ADJUST row, as written by an operator correcting a balance.
     */
    public static PointsTransaction manualAdjustment(Long userId, int points, String description, String createdBy) {
        return PointsTransaction.reconstitute(null, userId, points, TransactionType.ADJUST, null, description,
                createdBy, null, null);
    }
}
