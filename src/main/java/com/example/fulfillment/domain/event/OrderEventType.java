package com.example.fulfillment.domain.event;

import com.example.fulfillment.domain.model.OrderStatus;

import java.util.Optional;

/**
 * Events emitted when an order enters a status with loyalty consequences.
 */
public enum OrderEventType {

    ORDER_COMPLETED("order_completed"),
    ORDER_CANCELED("order_canceled"),
    ORDER_REFUNDED("order_refunded"),
    ORDER_RETURNED("order_returned");

    private final String eventName;

    OrderEventType(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }

    /**
     * Event emitted on entering the given status, if any.
     */
    public static Optional<OrderEventType> forStatus(OrderStatus status) {
        return switch (status) {
            case COMPLETED -> Optional.of(ORDER_COMPLETED);
            case CANCELED -> Optional.of(ORDER_CANCELED);
            case REFUNDED -> Optional.of(ORDER_REFUNDED);
            case RETURNED -> Optional.of(ORDER_RETURNED);
            default -> Optional.empty();
        };
    }
}
