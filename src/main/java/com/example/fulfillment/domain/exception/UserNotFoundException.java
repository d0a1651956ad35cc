package com.example.fulfillment.domain.exception;

/**
 * Exception thrown when a user cannot be found.
 */
public class UserNotFoundException extends DomainException {

    private final Long userId;

    public UserNotFoundException(Long userId) {
        super("User not found: " + userId);
        this.userId = userId;
    }

    public Long getUserId() {
        return userId;
    }
}
