package com.example.fulfillment.domain.exception;

/**
 * Base class for business rule violations raised by the domain layer.
 */
public abstract class DomainException extends RuntimeException {

    protected DomainException(String message) {
        super(message);
    }
}
