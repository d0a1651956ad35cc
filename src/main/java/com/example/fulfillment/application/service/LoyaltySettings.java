package com.example.fulfillment.application.service;

import com.example.fulfillment.application.port.out.SettingsPort;
import com.example.fulfillment.domain.model.PriceBasis;
import com.example.fulfillment.domain.service.PointsCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Typed access to the loyalty settings. Values are read on every call so that
 * runtime changes take effect without a restart. Unparseable values fall back
 * to the default and are logged.
 */
@Component
public class LoyaltySettings {

    private static final Logger log = LoggerFactory.getLogger(LoyaltySettings.class);

    public static final String ENABLED = "LOYALTY_ENABLED";
    public static final String POINTS_FACTOR = "LOYALTY_POINTS_FACTOR";
    public static final String PRICE_BASIS = "LOYALTY_PRICE_BASIS";
    public static final String TIER_MULTIPLIER_ENABLED = "LOYALTY_TIER_MULTIPLIER_ENABLED";
    public static final String XP_PER_LEVEL = "LOYALTY_XP_PER_LEVEL";
    public static final String POINTS_EXPIRATION_DAYS = "LOYALTY_POINTS_EXPIRATION_DAYS";
    public static final String NEW_CUSTOMER_BONUS_ENABLED = "LOYALTY_NEW_CUSTOMER_BONUS_ENABLED";
    public static final String NEW_CUSTOMER_BONUS_POINTS = "LOYALTY_NEW_CUSTOMER_BONUS_POINTS";
    public static final String REDEMPTION_RATIO_PREFIX = "LOYALTY_REDEMPTION_RATIO_";
    public static final String SUPPORTED_CURRENCIES = "LOYALTY_SUPPORTED_CURRENCIES";

    static final int DEFAULT_XP_PER_LEVEL = 1000;
    private static final BigDecimal DEFAULT_REDEMPTION_RATIO = BigDecimal.valueOf(100);

    private final SettingsPort settingsPort;

    public LoyaltySettings(SettingsPort settingsPort) {
        this.settingsPort = settingsPort;
    }

    public boolean isEnabled() {
        return read(ENABLED, Boolean::parseBoolean, false);
    }

    public BigDecimal pointsFactor() {
        return read(POINTS_FACTOR, BigDecimal::new, BigDecimal.ONE);
    }

    public PriceBasis priceBasis() {
        return read(PRICE_BASIS, PriceBasis::fromKey, PriceBasis.FINAL_PRICE);
    }

    public boolean isTierMultiplierEnabled() {
        return read(TIER_MULTIPLIER_ENABLED, Boolean::parseBoolean, false);
    }

    public int xpPerLevel() {
        return read(XP_PER_LEVEL, Integer::parseInt, DEFAULT_XP_PER_LEVEL);
    }

    /**
     * 0 disables expiration.
     */
    public int expirationDays() {
        return read(POINTS_EXPIRATION_DAYS, Integer::parseInt, 0);
    }

    public boolean isNewCustomerBonusEnabled() {
        return read(NEW_CUSTOMER_BONUS_ENABLED, Boolean::parseBoolean, false);
    }

    public int newCustomerBonusPoints() {
        return read(NEW_CUSTOMER_BONUS_POINTS, Integer::parseInt, 100);
    }

    /**
     * Points per one unit of the currency. Non-positive values fall back to the default.
     */
    public BigDecimal redemptionRatio(String currency) {
        String key = REDEMPTION_RATIO_PREFIX + currency.toUpperCase(Locale.ROOT);
        BigDecimal ratio = read(key, BigDecimal::new, DEFAULT_REDEMPTION_RATIO);
        if (ratio.signum() <= 0) {
            log.warn("Ignoring non-positive redemption ratio {}={}, using {}", key, ratio, DEFAULT_REDEMPTION_RATIO);
            return DEFAULT_REDEMPTION_RATIO;
        }
        return ratio;
    }

    public Set<String> supportedCurrencies() {
        return read(SUPPORTED_CURRENCIES, LoyaltySettings::parseCurrencies, Set.of("EUR", "USD"));
    }

    public PointsCalculator pointsCalculator() {
        return new PointsCalculator(priceBasis(), pointsFactor(), isTierMultiplierEnabled());
    }

    private static Set<String> parseCurrencies(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(code -> !code.isEmpty())
                .map(code -> code.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    private <T> T read(String key, Function<String, T> parser, T defaultValue) {
        return settingsPort.get(key)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .map(value -> {
                    try {
                        return parser.apply(value);
                    } catch (RuntimeException e) {
                        log.warn("Invalid value for setting {}: '{}', using default {}", key, value, defaultValue);
                        return defaultValue;
                    }
                })
                .orElse(defaultValue);
    }
}
