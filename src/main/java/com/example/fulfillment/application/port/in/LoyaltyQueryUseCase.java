package com.example.fulfillment.application.port.in;

import com.example.fulfillment.application.dto.LedgerEntryView;
import com.example.fulfillment.application.dto.LoyaltySummary;
import com.example.fulfillment.domain.model.LoyaltyTier;

import java.util.List;

/**
 * Inbound port for derived loyalty views.
 */
public interface LoyaltyQueryUseCase {

    long getBalance(Long userId);

    int getLevel(Long userId);

    LoyaltySummary getSummary(Long userId);

    List<LedgerEntryView> getTransactions(Long userId);

    List<LoyaltyTier> listTiers();

    /**
     * Points one unit of the product would earn for the user, or for a tierless user when userId is null.
     */
    int getProductPotentialPoints(Long productId, Long userId);
}
