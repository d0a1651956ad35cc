package com.example.fulfillment.domain.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Catalog product as seen by the fulfillment ledger: price components, stock and points settings.
 */
public final class Product {

    private final Long id;
    private final String name;
    private final Money price;
    private final BigDecimal vatPercent;
    private final BigDecimal discountPercent;
    private final int stock;
    private final BigDecimal pointsCoefficient;
    private final int fixedBonusPoints;

    private Product(Long id, String name, Money price, BigDecimal vatPercent, BigDecimal discountPercent,
                    int stock, BigDecimal pointsCoefficient, int fixedBonusPoints) {
        this.id = id;
        this.name = name;
        this.price = Objects.requireNonNull(price, "Price cannot be null");
        this.vatPercent = vatPercent == null ? BigDecimal.ZERO : vatPercent;
        this.discountPercent = discountPercent == null ? BigDecimal.ZERO : discountPercent;
        this.pointsCoefficient = pointsCoefficient == null ? BigDecimal.ONE : pointsCoefficient;
        if (stock < 0) {
            throw new IllegalArgumentException("Stock cannot be negative: " + stock);
        }
        if (fixedBonusPoints < 0) {
            throw new IllegalArgumentException("Fixed bonus points cannot be negative: " + fixedBonusPoints);
        }
        this.stock = stock;
        this.fixedBonusPoints = fixedBonusPoints;
    }

    public static Product of(Long id, String name, Money price, BigDecimal vatPercent, BigDecimal discountPercent,
                             int stock, BigDecimal pointsCoefficient, int fixedBonusPoints) {
        return new Product(id, name, price, vatPercent, discountPercent, stock, pointsCoefficient, fixedBonusPoints);
    }

    public Money getVatValue() {
        return price.percentage(vatPercent);
    }

    public Money getDiscountValue() {
        return price.percentage(discountPercent);
    }

    /**
     * Price with VAT added and discount taken off.
     */
    public Money getFinalPrice() {
        return price.add(getVatValue()).subtractFloored(getDiscountValue());
    }

    /**
     * Selects the amount used as points base for the given mode.
     */
    public Money priceFor(PriceBasis basis) {
        return switch (basis) {
            case PRICE_EXCL_VAT_NO_DISCOUNT -> price;
            case PRICE_EXCL_VAT_WITH_DISCOUNT -> price.subtractFloored(getDiscountValue());
            case PRICE_INCL_VAT_NO_DISCOUNT -> price.add(getVatValue());
            case FINAL_PRICE -> getFinalPrice();
        };
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Money getPrice() {
        return price;
    }

    public BigDecimal getVatPercent() {
        return vatPercent;
    }

    public BigDecimal getDiscountPercent() {
        return discountPercent;
    }

    public int getStock() {
        return stock;
    }

    public BigDecimal getPointsCoefficient() {
        return pointsCoefficient;
    }

    public int getFixedBonusPoints() {
        return fixedBonusPoints;
    }

    @Override
    public String toString() {
        return "Product{id=" + id + ", name='" + name + "', price=" + price + ", stock=" + stock + '}';
    }
}
