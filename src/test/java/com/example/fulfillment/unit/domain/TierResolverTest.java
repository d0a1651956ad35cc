package com.example.fulfillment.unit.domain;

import com.example.fulfillment.domain.model.LoyaltyTier;
import com.example.fulfillment.domain.service.TierResolver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TierResolver Tests")
class TierResolverTest {

    private final List<LoyaltyTier> tiers = List.of(
            new LoyaltyTier(1L, "Bronze", 1, BigDecimal.ONE, null),
            new LoyaltyTier(2L, "Silver", 3, new BigDecimal("1.25"), null),
            new LoyaltyTier(3L, "Gold", 5, new BigDecimal("1.5"), null)
    );

    @Test
    @DisplayName("should_derive_level_from_xp")
    void should_derive_level_from_xp() {
        assertThat(TierResolver.levelFor(0, 1000)).isEqualTo(1);
        assertThat(TierResolver.levelFor(999, 1000)).isEqualTo(1);
        assertThat(TierResolver.levelFor(1000, 1000)).isEqualTo(2);
        assertThat(TierResolver.levelFor(4500, 1000)).isEqualTo(5);
    }

    @Test
    @DisplayName("should_stay_at_level_one_for_non_positive_xp_per_level")
    void should_stay_at_level_one_for_non_positive_xp_per_level() {
        assertThat(TierResolver.levelFor(50_000, 0)).isEqualTo(1);
    }

    @Test
    @DisplayName("should_pick_highest_reached_tier")
    void should_pick_highest_reached_tier() {
        assertThat(TierResolver.tierFor(1, tiers)).map(LoyaltyTier::name).contains("Bronze");
        assertThat(TierResolver.tierFor(4, tiers)).map(LoyaltyTier::name).contains("Silver");
        assertThat(TierResolver.tierFor(9, tiers)).map(LoyaltyTier::name).contains("Gold");
    }

    @Test
    @DisplayName("should_find_next_tier_or_none_at_top")
    void should_find_next_tier_or_none_at_top() {
        assertThat(TierResolver.nextTier(3, tiers)).map(LoyaltyTier::name).contains("Gold");
        assertThat(TierResolver.nextTier(5, tiers)).isEmpty();
    }

    @Test
    @DisplayName("should_reject_multiplier_below_one")
    void should_reject_multiplier_below_one() {
        assertThatThrownBy(() -> new LoyaltyTier(9L, "Broken", 1, new BigDecimal("0.9"), null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
