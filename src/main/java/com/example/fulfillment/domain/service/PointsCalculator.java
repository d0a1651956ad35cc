package com.example.fulfillment.domain.service;

import com.example.fulfillment.domain.model.PriceBasis;
import com.example.fulfillment.domain.model.Product;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Pure points arithmetic for one order line.
 * <p>
 * {@code points = floor(basis * factor * coefficient * quantity [* multiplier]) + fixedBonus * quantity}.
 * The multiplier applies only when tier multipliers are enabled and it is above 1.0.
 * Fixed bonus points are added after flooring and are never multiplied.
 */
public final class PointsCalculator {

    private final PriceBasis priceBasis;
    private final BigDecimal pointsFactor;
    private final boolean tierMultiplierEnabled;

    public PointsCalculator(PriceBasis priceBasis, BigDecimal pointsFactor, boolean tierMultiplierEnabled) {
        this.priceBasis = Objects.requireNonNull(priceBasis, "Price basis cannot be null");
        this.pointsFactor = Objects.requireNonNull(pointsFactor, "Points factor cannot be null");
        this.tierMultiplierEnabled = tierMultiplierEnabled;
    }

    /**
     * Points for {@code quantity} units of a product.
     *
     * @param product        the product, providing price basis, coefficient and fixed bonus
     * @param quantity       number of units
     * @param tierMultiplier the user's tier multiplier, 1.0 when the user has no tier
     * @return points to award, never negative
     */
    public int calculateItemPoints(Product product, int quantity, BigDecimal tierMultiplier) {
        return calculate(
                product.priceFor(priceBasis).getAmount(),
                product.getPointsCoefficient(),
                quantity,
                tierMultiplier,
                product.getFixedBonusPoints());
    }

    int calculate(BigDecimal basisAmount, BigDecimal coefficient, int quantity,
                  BigDecimal tierMultiplier, int fixedBonusPoints) {
        if (quantity <= 0) {
            return 0;
        }
        BigDecimal raw = basisAmount
                .multiply(pointsFactor)
                .multiply(coefficient)
                .multiply(BigDecimal.valueOf(quantity));
        if (tierMultiplierEnabled && tierMultiplier != null && tierMultiplier.compareTo(BigDecimal.ONE) > 0) {
            raw = raw.multiply(tierMultiplier);
        }
        int floored = raw.setScale(0, RoundingMode.DOWN).intValueExact();
        return Math.max(0, floored) + fixedBonusPoints * quantity;
    }
}
