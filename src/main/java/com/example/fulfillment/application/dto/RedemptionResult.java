package com.example.fulfillment.application.dto;

import java.math.BigDecimal;

public record RedemptionResult(
        Long userId,
        int pointsRedeemed,
        BigDecimal discountAmount,
        String currency,
        long remainingBalance
) {
}
