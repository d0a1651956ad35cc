package com.example.fulfillment.application.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Command for placing a new order.
 *
 * @param userId                owning user, null for a guest checkout
 * @param currency              order currency, null for the configured default
 * @param shippingPrice         shipping cost, null for free shipping
 * @param items                 ordered products
 * @param loyaltyPointsToRedeem points to redeem at checkout, null or 0 for none
 */
public record PlaceOrderCommand(
        Long userId,
        String currency,
        BigDecimal shippingPrice,
        List<OrderLineDto> items,
        Integer loyaltyPointsToRedeem
) {
    public PlaceOrderCommand {
        Objects.requireNonNull(items, "Items cannot be null");
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Items cannot be empty");
        }
        if (shippingPrice != null && shippingPrice.compareTo(BigDecimal.ZERO) < 0) {
            throw new IllegalArgumentException("ShippingPrice cannot be negative");
        }
        items = List.copyOf(items);
    }

    public boolean redeemsPoints() {
        return loyaltyPointsToRedeem != null && loyaltyPointsToRedeem != 0;
    }

    /**
     * DTO for an order line in the command.
     */
    public record OrderLineDto(
            Long productId,
            int quantity
    ) {
        public OrderLineDto {
            Objects.requireNonNull(productId, "ProductId cannot be null");
            if (quantity <= 0) {
                throw new IllegalArgumentException("Quantity must be positive");
            }
        }
    }
}
