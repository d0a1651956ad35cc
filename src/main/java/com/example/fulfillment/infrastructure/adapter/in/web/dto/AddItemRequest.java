package com.example.fulfillment.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record AddItemRequest(
        @NotNull(message = "Product id is required")
        Long productId,

        @Positive(message = "Quantity must be positive")
        int quantity
) {}
