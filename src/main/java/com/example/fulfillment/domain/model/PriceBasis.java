package com.example.fulfillment.domain.model;

import java.util.Arrays;

/**
 * Which product price is used as the base for loyalty points.
 */
public enum PriceBasis {

    PRICE_EXCL_VAT_NO_DISCOUNT("price_excl_vat_no_discount"),
    PRICE_EXCL_VAT_WITH_DISCOUNT("price_excl_vat_with_discount"),
    PRICE_INCL_VAT_NO_DISCOUNT("price_incl_vat_no_discount"),
    FINAL_PRICE("final_price");

    private final String key;

    PriceBasis(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * Resolves a setting value such as {@code final_price}. Unknown values fall back to FINAL_PRICE.
     */
    public static PriceBasis fromKey(String key) {
        if (key == null) {
            return FINAL_PRICE;
        }
        return Arrays.stream(values())
                .filter(basis -> basis.key.equalsIgnoreCase(key.trim()) || basis.name().equalsIgnoreCase(key.trim()))
                .findFirst()
                .orElse(FINAL_PRICE);
    }
}
