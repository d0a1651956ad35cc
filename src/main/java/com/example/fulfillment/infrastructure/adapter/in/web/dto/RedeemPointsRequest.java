package com.example.fulfillment.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for redeeming points. The amount is checked by the ledger so
 * that a non-positive value is reported with its loyalty rejection reason.
 */
public record RedeemPointsRequest(
        @NotNull(message = "User id is required")
        Long userId,

        int points,

        @NotBlank(message = "Currency is required")
        String currency,

        Long orderId
) {}
