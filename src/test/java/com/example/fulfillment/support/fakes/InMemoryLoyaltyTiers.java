package com.example.fulfillment.support.fakes;

import com.example.fulfillment.application.port.out.LoyaltyTierPort;
import com.example.fulfillment.domain.model.LoyaltyTier;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public class InMemoryLoyaltyTiers implements LoyaltyTierPort {

    private final List<LoyaltyTier> tiers = new ArrayList<>();

    public LoyaltyTier add(Long id, String name, int requiredLevel, String multiplier) {
        LoyaltyTier tier = new LoyaltyTier(id, name, requiredLevel, new BigDecimal(multiplier), null);
        tiers.add(tier);
        return tier;
    }

    @Override
    public List<LoyaltyTier> findAllOrdered() {
        return tiers.stream().sorted(Comparator.comparingInt(LoyaltyTier::requiredLevel)).toList();
    }

    @Override
    public Optional<LoyaltyTier> findById(Long tierId) {
        return tiers.stream().filter(tier -> tier.id().equals(tierId)).findFirst();
    }
}
