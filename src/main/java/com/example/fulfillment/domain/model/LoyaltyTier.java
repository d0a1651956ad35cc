package com.example.fulfillment.domain.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Administrator-managed tier reached at a given level.
 */
public record LoyaltyTier(
        Long id,
        String name,
        int requiredLevel,
        BigDecimal pointsMultiplier,
        String description
) {
    public LoyaltyTier {
        Objects.requireNonNull(name, "Name cannot be null");
        Objects.requireNonNull(pointsMultiplier, "Points multiplier cannot be null");
        if (requiredLevel < 1) {
            throw new IllegalArgumentException("Required level must be at least 1: " + requiredLevel);
        }
        if (pointsMultiplier.compareTo(BigDecimal.ONE) < 0) {
            throw new IllegalArgumentException("Points multiplier must be at least 1.0: " + pointsMultiplier);
        }
    }
}
