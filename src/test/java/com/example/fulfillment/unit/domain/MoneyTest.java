package com.example.fulfillment.unit.domain;

import com.example.fulfillment.domain.exception.CurrencyMismatchException;
import com.example.fulfillment.domain.model.Money;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Money Value Object Tests")
class MoneyTest {

    @Test
    @DisplayName("should_add_amounts_of_same_currency")
    void should_add_amounts_of_same_currency() {
        // Given
        Money a = Money.of("10.50", "EUR");
        Money b = Money.of("4.25", "EUR");

        // When
        Money sum = a.add(b);

        // Then
        assertThat(sum).isEqualTo(Money.of("14.75", "EUR"));
    }

    @Test
    @DisplayName("should_reject_arithmetic_across_currencies")
    void should_reject_arithmetic_across_currencies() {
        // Given
        Money eur = Money.of("10.00", "EUR");
        Money usd = Money.of("10.00", "USD");

        // When & Then
        assertThatThrownBy(() -> eur.add(usd))
                .isInstanceOf(CurrencyMismatchException.class);
    }

    @Test
    @DisplayName("should_floor_subtraction_at_zero")
    void should_floor_subtraction_at_zero() {
        // When
        Money result = Money.of("5.00", "EUR").subtractFloored(Money.of("7.50", "EUR"));

        // Then
        assertThat(result.isZero()).isTrue();
    }

    @Test
    @DisplayName("should_reject_negative_amount")
    void should_reject_negative_amount() {
        assertThatThrownBy(() -> Money.of("-0.01", "EUR"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("negative");
    }

    @Test
    @DisplayName("should_compute_percentage_rounded_to_cents")
    void should_compute_percentage_rounded_to_cents() {
        // When: 21% of 9.99 = 2.0979
        Money vat = Money.of("9.99", "EUR").percentage(new BigDecimal("21"));

        // Then
        assertThat(vat.getAmount()).isEqualByComparingTo("2.10");
    }

    @Test
    @DisplayName("should_treat_scale_differences_as_equal")
    void should_treat_scale_differences_as_equal() {
        assertThat(Money.of("3", "EUR")).isEqualTo(Money.of("3.00", "EUR"));
        assertThat(Money.of("3", "EUR").hashCode()).isEqualTo(Money.of("3.00", "EUR").hashCode());
    }
}
