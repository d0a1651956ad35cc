package com.example.fulfillment.unit.application;

import com.example.fulfillment.application.service.LoyaltySettings;
import com.example.fulfillment.domain.model.PriceBasis;
import com.example.fulfillment.support.fakes.InMemorySettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("LoyaltySettings Tests")
class LoyaltySettingsTest {

    private final InMemorySettings store = new InMemorySettings();
    private final LoyaltySettings settings = new LoyaltySettings(store);

    @Test
    @DisplayName("should_use_defaults_when_nothing_configured")
    void should_use_defaults_when_nothing_configured() {
        assertThat(settings.isEnabled()).isFalse();
        assertThat(settings.pointsFactor()).isEqualByComparingTo("1");
        assertThat(settings.priceBasis()).isEqualTo(PriceBasis.FINAL_PRICE);
        assertThat(settings.xpPerLevel()).isEqualTo(1000);
        assertThat(settings.expirationDays()).isZero();
        assertThat(settings.supportedCurrencies()).containsExactlyInAnyOrder("EUR", "USD");
    }

    @Test
    @DisplayName("should_fall_back_to_default_for_unparseable_value")
    void should_fall_back_to_default_for_unparseable_value() {
        store.set(LoyaltySettings.XP_PER_LEVEL, "lots")
                .set(LoyaltySettings.POINTS_FACTOR, "1,5");

        assertThat(settings.xpPerLevel()).isEqualTo(1000);
        assertThat(settings.pointsFactor()).isEqualByComparingTo("1");
    }

    @Test
    @DisplayName("should_read_changed_values_without_restart")
    void should_read_changed_values_without_restart() {
        store.set(LoyaltySettings.ENABLED, "true");
        assertThat(settings.isEnabled()).isTrue();

        store.set(LoyaltySettings.ENABLED, "false");
        assertThat(settings.isEnabled()).isFalse();
    }

    @Test
    @DisplayName("should_resolve_redemption_ratio_per_currency")
    void should_resolve_redemption_ratio_per_currency() {
        store.set("LOYALTY_REDEMPTION_RATIO_CHF", "80")
                .set("LOYALTY_REDEMPTION_RATIO_GBP", "-5");

        assertThat(settings.redemptionRatio("chf")).isEqualByComparingTo("80");
        assertThat(settings.redemptionRatio("GBP")).isEqualByComparingTo("100");
        assertThat(settings.redemptionRatio("EUR")).isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("should_parse_supported_currency_list")
    void should_parse_supported_currency_list() {
        store.set(LoyaltySettings.SUPPORTED_CURRENCIES, " eur, chf ,,GBP");

        assertThat(settings.supportedCurrencies()).containsExactlyInAnyOrder("EUR", "CHF", "GBP");
    }
}
