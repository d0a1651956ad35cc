package com.example.fulfillment.application.port.out;

import com.example.fulfillment.domain.exception.InsufficientStockException;
import com.example.fulfillment.domain.exception.ProductNotFoundException;

/**
 * Outbound port for atomic product stock mutations.
 */
public interface StockGuard {

    /**
     * Decrements stock only if enough units are available. The check and the
     * decrement are one atomic step per product row.
     *
     * @param productId the product
     * @param quantity  units to reserve (must be positive)
     * @param orderId   order the reservation belongs to, may be null
     * @throws InsufficientStockException if fewer than {@code quantity} units are available
     * @throws ProductNotFoundException   if the product does not exist
     */
    void reserve(Long productId, int quantity, Long orderId);

    /**
     * Increments stock unconditionally. Callers pass the exact quantity they reserved earlier.
     *
     * @param productId the product
     * @param quantity  units to give back (must be positive)
     * @param orderId   order the units came from, may be null
     */
    void restore(Long productId, int quantity, Long orderId);

    /**
     * Decrements stock for an already reserved line whose quantity grew, without
     * the availability check. Stock is floored at zero.
     */
    void deductExempt(Long productId, int quantity, Long orderId);
}
