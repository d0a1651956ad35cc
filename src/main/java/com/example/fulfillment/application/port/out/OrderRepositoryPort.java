package com.example.fulfillment.application.port.out;

import com.example.fulfillment.domain.model.Order;
import com.example.fulfillment.domain.model.OrderHistoryEntry;

import java.util.List;
import java.util.Optional;

/**
 * Outbound port for order persistence.
 */
public interface OrderRepositoryPort {

    Optional<Order> findById(Long orderId);

    /**
     * Loads the order and holds a write lock on its row until the transaction ends.
     */
    Optional<Order> findByIdForUpdate(Long orderId);

    /**
     * Inserts a new order or updates an existing one, including its items.
     *
     * @return the order as stored, with generated identifiers
     */
    Order save(Order order);

    void appendHistory(OrderHistoryEntry entry);

    List<OrderHistoryEntry> findHistory(Long orderId);
}
