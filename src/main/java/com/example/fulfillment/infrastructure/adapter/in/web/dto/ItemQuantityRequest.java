package com.example.fulfillment.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.Positive;

/**
 * Quantity body shared by the item update and item refund calls.
 */
public record ItemQuantityRequest(
        @Positive(message = "Quantity must be positive")
        int quantity
) {}
