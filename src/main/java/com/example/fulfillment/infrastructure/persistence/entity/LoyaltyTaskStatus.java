package com.example.fulfillment.infrastructure.persistence.entity;

/**
 * Status of a queued loyalty task.
 */
public enum LoyaltyTaskStatus {
    PENDING,
    PROCESSING,
    PROCESSED,
    FAILED
}
