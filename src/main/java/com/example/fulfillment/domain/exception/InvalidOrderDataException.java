package com.example.fulfillment.domain.exception;

public class InvalidOrderDataException extends DomainException {

    public InvalidOrderDataException(String message) {
        super(message);
    }
}
