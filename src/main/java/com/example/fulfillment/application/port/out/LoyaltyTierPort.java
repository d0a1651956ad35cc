package com.example.fulfillment.application.port.out;

import com.example.fulfillment.domain.model.LoyaltyTier;

import java.util.List;
import java.util.Optional;

public interface LoyaltyTierPort {

    /**
     * All tiers ordered by required level.
     */
    List<LoyaltyTier> findAllOrdered();

    Optional<LoyaltyTier> findById(Long tierId);
}
