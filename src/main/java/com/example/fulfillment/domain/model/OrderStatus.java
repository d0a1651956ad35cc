package com.example.fulfillment.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Enum representing the possible states of an Order, together with the
 * transitions allowed out of each state.
 */
public enum OrderStatus {

    /**
     * Initial state, awaiting payment or processing.
     */
    PENDING,

    /**
     * Order is paid or accepted and being prepared.
     */
    PROCESSING,

    /**
     * Order has left the warehouse.
     */
    SHIPPED,

    /**
     * Order has been delivered to the customer.
     */
    DELIVERED,

    /**
     * Order is fulfilled. Entering this state awards loyalty points.
     */
    COMPLETED,

    /**
     * Order was canceled before shipping. Stock is restored.
     */
    CANCELED,

    /**
     * Goods were sent back by the customer.
     */
    RETURNED,

    /**
     * Payment was given back to the customer.
     */
    REFUNDED;

    private static final Map<OrderStatus, Set<OrderStatus>> TRANSITIONS = new EnumMap<>(OrderStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(PROCESSING, CANCELED));
        TRANSITIONS.put(PROCESSING, EnumSet.of(SHIPPED, CANCELED));
        TRANSITIONS.put(SHIPPED, EnumSet.of(DELIVERED, RETURNED));
        TRANSITIONS.put(DELIVERED, EnumSet.of(COMPLETED, RETURNED));
        TRANSITIONS.put(COMPLETED, EnumSet.of(RETURNED, REFUNDED));
        TRANSITIONS.put(RETURNED, EnumSet.of(REFUNDED));
        TRANSITIONS.put(CANCELED, EnumSet.noneOf(OrderStatus.class));
        TRANSITIONS.put(REFUNDED, EnumSet.noneOf(OrderStatus.class));
    }

    /**
     * Returns the statuses this status may move to.
     */
    public Set<OrderStatus> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean canTransitionTo(OrderStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    /**
     * Items may be added or re-quantified only before the order ships.
     */
    public boolean isEditable() {
        return this == PENDING || this == PROCESSING;
    }
}
