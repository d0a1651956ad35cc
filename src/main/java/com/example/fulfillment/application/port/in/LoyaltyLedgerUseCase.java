package com.example.fulfillment.application.port.in;

import com.example.fulfillment.domain.model.LoyaltyTier;

import java.util.Optional;

/**
 * Inbound port for ledger mutations driven by order lifecycle tasks.
 * Every operation is idempotent.
 */
public interface LoyaltyLedgerUseCase {

    /**
     * @return points awarded, 0 when already awarded or not applicable
     */
    int awardOrderPoints(Long orderId);

    /**
     * @return points reversed, possibly clamped to the available balance
     */
    int reverseOrderPoints(Long orderId);

    /**
     * @return number of EXPIRE rows written
     */
    int processExpiration();

    /**
     * @return bonus points awarded, 0 when not eligible
     */
    int checkNewCustomerBonus(Long userId, Long orderId);

    Optional<LoyaltyTier> recalculateTier(Long userId);

    /**
     * Whether the order has EARN rows, whichever call wrote them.
     */
    boolean hasEarnedPoints(Long orderId);
}
