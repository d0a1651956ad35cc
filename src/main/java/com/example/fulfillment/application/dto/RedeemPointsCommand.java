package com.example.fulfillment.application.dto;

import java.util.Objects;

/**
 * Command for redeeming points into a monetary discount.
 * Amount and currency are validated by the loyalty service so that the
 * caller receives the specific rejection reason.
 */
public record RedeemPointsCommand(
        Long userId,
        int points,
        String currency,
        Long orderId
) {
    public RedeemPointsCommand {
        Objects.requireNonNull(userId, "UserId cannot be null");
    }
}
