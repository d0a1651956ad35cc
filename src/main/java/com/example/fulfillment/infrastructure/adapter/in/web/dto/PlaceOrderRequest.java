package com.example.fulfillment.infrastructure.adapter.in.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.util.List;

/**
 * Request DTO for placing an order via REST API.
 */
public record PlaceOrderRequest(
        Long userId,

        @Pattern(regexp = "^[A-Za-z]{3}$", message = "Currency must be a 3-letter code")
        String currency,

        @PositiveOrZero(message = "Shipping price cannot be negative")
        BigDecimal shippingPrice,

        @NotEmpty(message = "Items cannot be empty")
        @Valid
        List<OrderLineRequest> items,

        Integer loyaltyPointsToRedeem
) {
    public record OrderLineRequest(
            @NotNull(message = "Product id is required")
            Long productId,

            @Positive(message = "Quantity must be positive")
            int quantity
    ) {}
}
