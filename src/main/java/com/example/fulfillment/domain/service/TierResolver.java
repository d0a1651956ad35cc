package com.example.fulfillment.domain.service;

import com.example.fulfillment.domain.model.LoyaltyTier;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Derives level and tier from total XP.
 */
public final class TierResolver {

    private TierResolver() {
    }

    /**
     * {@code 1 + floor(totalXp / xpPerLevel)}; level 1 when xpPerLevel is not positive.
     */
    public static int levelFor(long totalXp, int xpPerLevel) {
        if (xpPerLevel <= 0) {
            return 1;
        }
        return (int) (1 + Math.max(0, totalXp) / xpPerLevel);
    }

    /**
     * Highest tier whose required level is at most the given level.
     */
    public static Optional<LoyaltyTier> tierFor(int level, List<LoyaltyTier> tiers) {
        return tiers.stream()
                .filter(tier -> tier.requiredLevel() <= level)
                .max(Comparator.comparingInt(LoyaltyTier::requiredLevel));
    }

    /**
     * Lowest tier whose required level is above the given level.
     */
    public static Optional<LoyaltyTier> nextTier(int level, List<LoyaltyTier> tiers) {
        return tiers.stream()
                .filter(tier -> tier.requiredLevel() > level)
                .min(Comparator.comparingInt(LoyaltyTier::requiredLevel));
    }
}
