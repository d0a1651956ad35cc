package com.example.fulfillment.infrastructure.config;

import com.example.fulfillment.application.service.LoyaltySettings;
import com.example.fulfillment.infrastructure.persistence.SettingsAdapter;
import org.springframework.boot.actuate.endpoint.annotation.DeleteOperation;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.Selector;
import org.springframework.boot.actuate.endpoint.annotation.WriteOperation;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Actuator endpoint for reading and changing loyalty settings at runtime.
 * Only keys with the {@code LOYALTY_} prefix are accepted.
 */
@Component
@Endpoint(id = "loyaltysettings")
public class LoyaltySettingsEndpoint {

    private static final String PREFIX = "LOYALTY_";

    private static final List<String> KNOWN_KEYS = List.of(
            LoyaltySettings.ENABLED,
            LoyaltySettings.POINTS_FACTOR,
            LoyaltySettings.PRICE_BASIS,
            LoyaltySettings.TIER_MULTIPLIER_ENABLED,
            LoyaltySettings.XP_PER_LEVEL,
            LoyaltySettings.POINTS_EXPIRATION_DAYS,
            LoyaltySettings.NEW_CUSTOMER_BONUS_ENABLED,
            LoyaltySettings.NEW_CUSTOMER_BONUS_POINTS,
            LoyaltySettings.SUPPORTED_CURRENCIES
    );

    private final SettingsAdapter settingsAdapter;

    public LoyaltySettingsEndpoint(SettingsAdapter settingsAdapter) {
        this.settingsAdapter = settingsAdapter;
    }

    @ReadOperation
    public Map<String, Object> settings() {
        Map<String, Object> values = new LinkedHashMap<>();
        KNOWN_KEYS.forEach(key -> values.put(key, settingsAdapter.get(key).orElse(null)));
        return values;
    }

    @WriteOperation
    public Map<String, Object> update(String key, String value) {
        requireLoyaltyKey(key);
        settingsAdapter.put(key, value);
        return Map.of("key", key, "value", value);
    }

    @DeleteOperation
    public Map<String, Object> reset(@Selector String key) {
        requireLoyaltyKey(key);
        settingsAdapter.remove(key);
        return Map.of("key", key, "value", String.valueOf(settingsAdapter.get(key).orElse(null)));
    }

    private static void requireLoyaltyKey(String key) {
        if (key == null || !key.startsWith(PREFIX)) {
            throw new IllegalArgumentException("Only " + PREFIX + "* settings can be changed: " + key);
        }
    }
}
