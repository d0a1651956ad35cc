package com.example.fulfillment.support.fakes;

import com.example.fulfillment.application.port.out.OrderRepositoryPort;
import com.example.fulfillment.domain.model.Order;
import com.example.fulfillment.domain.model.OrderHistoryEntry;
import com.example.fulfillment.domain.model.OrderItem;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Order store that hands out copies, so that an aggregate changed by a failed
 * operation never leaks into the stored state.
 */
public class InMemoryOrderRepository implements OrderRepositoryPort {

    private final Map<Long, Order> orders = new HashMap<>();
    private final List<OrderHistoryEntry> history = new ArrayList<>();
    private final AtomicLong orderIds = new AtomicLong();
    private final AtomicLong itemIds = new AtomicLong();

    @Override
    public Optional<Order> findById(Long orderId) {
        return Optional.ofNullable(orders.get(orderId)).map(order -> copy(order, order.getId()));
    }

    @Override
    public Optional<Order> findByIdForUpdate(Long orderId) {
        return findById(orderId);
    }

    @Override
    public Order save(Order order) {
        Long id = order.getId() != null ? order.getId() : orderIds.incrementAndGet();
        Order stored = copy(order, id);
        orders.put(id, stored);
        return copy(stored, id);
    }

    @Override
    public void appendHistory(OrderHistoryEntry entry) {
        history.add(entry);
    }

    @Override
    public List<OrderHistoryEntry> findHistory(Long orderId) {
        return history.stream().filter(entry -> entry.orderId().equals(orderId)).toList();
    }

    public List<OrderHistoryEntry> allHistory() {
        return List.copyOf(history);
    }

    private Order copy(Order order, Long id) {
        List<OrderItem> items = order.getItems().stream()
                .map(item -> OrderItem.reconstitute(
                        item.getId() != null ? item.getId() : itemIds.incrementAndGet(),
                        item.getProductId(),
                        item.getProductName(),
                        item.getUnitPrice(),
                        item.getQuantity(),
                        item.getRefundedQuantity(),
                        item.getOriginalQuantity()))
                .toList();
        return Order.reconstitute(id, order.getUuid(), order.getUserId(), order.getCurrency(), items,
                order.getShippingPrice(), order.getPaidAmount(), order.getStatus(), order.getPaymentStatus(),
                order.getTrackingNumber(), order.getCarrier(), new LinkedHashMap<>(order.getMetadata()),
                order.isDeleted(), order.getCreatedAt(), order.getStatusUpdatedAt());
    }
}
