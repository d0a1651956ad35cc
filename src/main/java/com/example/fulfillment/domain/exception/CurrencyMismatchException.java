package com.example.fulfillment.domain.exception;

/**
 * Exception thrown when two monetary amounts in different currencies are combined.
 */
public class CurrencyMismatchException extends DomainException {

    private final String expectedCurrency;
    private final String actualCurrency;

    public CurrencyMismatchException(String expectedCurrency, String actualCurrency) {
        super("Currency mismatch: " + expectedCurrency + " vs " + actualCurrency);
        this.expectedCurrency = expectedCurrency;
        this.actualCurrency = actualCurrency;
    }

    public String getExpectedCurrency() {
        return expectedCurrency;
    }

    public String getActualCurrency() {
        return actualCurrency;
    }
}
