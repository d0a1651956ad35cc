package com.example.fulfillment.domain.exception;

/**
 * Exception thrown when a points redemption is rejected.
 * The reason tells the caller which check failed.
 */
public class LoyaltyValidationException extends DomainException {

    public enum Reason {
        DISABLED,
        NON_POSITIVE_AMOUNT,
        UNSUPPORTED_CURRENCY,
        INSUFFICIENT_BALANCE
    }

    private final Reason reason;

    public LoyaltyValidationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static LoyaltyValidationException disabled() {
        return new LoyaltyValidationException(Reason.DISABLED, "Loyalty system is currently disabled.");
    }

    public static LoyaltyValidationException nonPositiveAmount() {
        return new LoyaltyValidationException(Reason.NON_POSITIVE_AMOUNT, "Points amount must be positive.");
    }

    public static LoyaltyValidationException unsupportedCurrency(String currency) {
        return new LoyaltyValidationException(Reason.UNSUPPORTED_CURRENCY,
                "Unsupported currency for points redemption: " + currency);
    }

    public static LoyaltyValidationException insufficientBalance(long available, int requested) {
        return new LoyaltyValidationException(Reason.INSUFFICIENT_BALANCE,
                String.format("Insufficient points balance. Available: %d, Requested: %d", available, requested));
    }

    public Reason getReason() {
        return reason;
    }
}
