package com.example.fulfillment.domain.exception;

/**
 * Exception thrown when a product cannot be found.
 */
public class ProductNotFoundException extends DomainException {

    private final Long productId;

    public ProductNotFoundException(Long productId) {
        super("Product not found: " + productId);
        this.productId = productId;
    }

    public Long getProductId() {
        return productId;
    }
}
