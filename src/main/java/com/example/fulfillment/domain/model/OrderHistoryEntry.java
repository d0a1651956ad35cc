package com.example.fulfillment.domain.model;

import java.time.Instant;

/**
 * Audit record appended on every order status write and on refunds.
 */
public record OrderHistoryEntry(
        Long orderId,
        ChangeType changeType,
        OrderStatus previousStatus,
        OrderStatus newStatus,
        String note,
        Instant occurredAt
) {
    public enum ChangeType {
        CREATED,
        STATUS,
        REFUND,
        NOTE
    }

    public static OrderHistoryEntry created(Long orderId) {
        return new OrderHistoryEntry(orderId, ChangeType.CREATED, null, OrderStatus.PENDING,
                "Order created", Instant.now());
    }

    public static OrderHistoryEntry statusChange(Long orderId, OrderStatus previous, OrderStatus next, String note) {
        return new OrderHistoryEntry(orderId, ChangeType.STATUS, previous, next, note, Instant.now());
    }

    public static OrderHistoryEntry refund(Long orderId, OrderStatus status, String note) {
        return new OrderHistoryEntry(orderId, ChangeType.REFUND, status, status, note, Instant.now());
    }
}
