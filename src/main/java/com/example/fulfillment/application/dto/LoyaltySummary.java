package com.example.fulfillment.application.dto;

import java.math.BigDecimal;

/**
 * Derived loyalty state of a user.
 *
 * @param pointsToNextTier XP still missing for the next tier, null when the user holds the highest tier
 */
public record LoyaltySummary(
        Long userId,
        long balance,
        long totalXp,
        int level,
        String tierName,
        BigDecimal tierMultiplier,
        Long pointsToNextTier
) {
}
