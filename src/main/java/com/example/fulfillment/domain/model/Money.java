package com.example.fulfillment.domain.model;

import com.example.fulfillment.domain.exception.CurrencyMismatchException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * Value Object representing a currency-tagged monetary amount.
 * Arithmetic between two amounts requires the same currency.
 */
public final class Money {

    private static final int SCALE = 2;

    private final BigDecimal amount;
    private final String currency;

    private Money(BigDecimal amount, String currency) {
        this.amount = amount.setScale(SCALE, RoundingMode.HALF_UP);
        this.currency = Objects.requireNonNull(currency, "Currency cannot be null");
        if (currency.isBlank()) {
            throw new IllegalArgumentException("Currency cannot be blank");
        }
    }

    /**
     * Creates Money with the specified amount and currency.
     *
     * @param amount   the monetary amount
     * @param currency the ISO currency code
     * @return new Money instance
     * @throws IllegalArgumentException if amount is negative
     */
    public static Money of(BigDecimal amount, String currency) {
        Objects.requireNonNull(amount, "Amount cannot be null");
        if (amount.compareTo(BigDecimal.ZERO) < 0) {
            throw new IllegalArgumentException("Amount cannot be negative: " + amount);
        }
        return new Money(amount, currency);
    }

    public static Money of(String amount, String currency) {
        return of(new BigDecimal(amount), currency);
    }

    /**
     * Creates Money with zero amount in the given currency.
     *
     * @param currency the ISO currency code
     * @return new Money instance with zero amount
     */
    public static Money zero(String currency) {
        return new Money(BigDecimal.ZERO, currency);
    }

    /**
     * Adds another Money to this one.
     *
     * @param other the Money to add
     * @return new Money with the sum
     * @throws CurrencyMismatchException if currencies don't match
     */
    public Money add(Money other) {
        requireSameCurrency(other);
        return new Money(this.amount.add(other.amount), this.currency);
    }

    /**
     * Subtracts another Money from this one, flooring the result at zero.
     *
     * @param other the Money to subtract
     * @return new Money with the difference, never negative
     * @throws CurrencyMismatchException if currencies don't match
     */
    public Money subtractFloored(Money other) {
        requireSameCurrency(other);
        BigDecimal result = this.amount.subtract(other.amount);
        return new Money(result.max(BigDecimal.ZERO), this.currency);
    }

    /**
     * Multiplies this Money by a quantity.
     *
     * @param quantity the multiplier
     * @return new Money with the product
     * @throws IllegalArgumentException if quantity is negative
     */
    public Money multiply(int quantity) {
        if (quantity < 0) {
            throw new IllegalArgumentException("Quantity cannot be negative: " + quantity);
        }
        return new Money(this.amount.multiply(BigDecimal.valueOf(quantity)), this.currency);
    }

    /**
     * Returns the given percentage of this amount, e.g. VAT or discount share.
     */
    public Money percentage(BigDecimal percent) {
        Objects.requireNonNull(percent, "Percent cannot be null");
        if (percent.compareTo(BigDecimal.ZERO) < 0) {
            throw new IllegalArgumentException("Percent cannot be negative: " + percent);
        }
        return new Money(this.amount.multiply(percent).divide(BigDecimal.valueOf(100), SCALE, RoundingMode.HALF_UP),
                this.currency);
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }

    public boolean hasCurrency(String otherCurrency) {
        return currency.equals(otherCurrency);
    }

    private void requireSameCurrency(Money other) {
        Objects.requireNonNull(other, "Cannot combine with null Money");
        if (!this.currency.equals(other.currency)) {
            throw new CurrencyMismatchException(this.currency, other.currency);
        }
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public String getCurrency() {
        return currency;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Money money = (Money) o;
        return amount.compareTo(money.amount) == 0 && Objects.equals(currency, money.currency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(amount.stripTrailingZeros(), currency);
    }

    @Override
    public String toString() {
        return amount.toPlainString() + " " + currency;
    }
}
