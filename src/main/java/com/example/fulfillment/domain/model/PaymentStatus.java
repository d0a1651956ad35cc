package com.example.fulfillment.domain.model;

public enum PaymentStatus {
    PENDING,
    COMPLETED,
    FAILED,
    PARTIALLY_REFUNDED,
    REFUNDED
}
