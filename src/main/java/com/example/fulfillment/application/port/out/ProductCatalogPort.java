package com.example.fulfillment.application.port.out;

import com.example.fulfillment.domain.model.Product;

import java.util.Optional;

/**
 * Outbound port for reading catalog products.
 */
public interface ProductCatalogPort {

    Optional<Product> findById(Long productId);
}
