package com.example.fulfillment.domain.event;

import java.time.Instant;
import java.util.Objects;

/**
 * Order lifecycle event. Carries identifiers only; handlers re-read state they need.
 */
public record OrderEvent(
        OrderEventType type,
        Long orderId,
        Long userId,
        Instant occurredAt
) {
    public OrderEvent {
        Objects.requireNonNull(type, "Type cannot be null");
        Objects.requireNonNull(orderId, "OrderId cannot be null");
        Objects.requireNonNull(occurredAt, "OccurredAt cannot be null");
    }

    public static OrderEvent of(OrderEventType type, Long orderId, Long userId) {
        return new OrderEvent(type, orderId, userId, Instant.now());
    }

    public boolean hasUser() {
        return userId != null;
    }
}
