package com.example.fulfillment.domain.model;

/**
 * Kinds of points ledger rows.
 */
public enum TransactionType {

    /**
     * Points earned from a completed order. Positive.
     */
    EARN,

    /**
     * Points spent for a discount. Negative.
     */
    REDEEM,

    /**
     * Offset of an EARN row older than the retention window. Negative or zero.
     */
    EXPIRE,

    /**
     * Correction row, e.g. reversal of an order's earned points. Any sign.
     */
    ADJUST,

    /**
     * One-time reward such as the new customer bonus. Positive.
     */
    BONUS
}
