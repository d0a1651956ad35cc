package com.example.fulfillment.infrastructure.persistence.entity;

/**
 * Persistence enum for order status.
 */
public enum OrderStatusEnum {
    PENDING,
    PROCESSING,
    SHIPPED,
    DELIVERED,
    COMPLETED,
    CANCELED,
    RETURNED,
    REFUNDED
}
