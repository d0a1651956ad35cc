package com.example.fulfillment.infrastructure.persistence;

import com.example.fulfillment.application.port.out.OrderRepositoryPort;
import com.example.fulfillment.domain.exception.OrderNotFoundException;
import com.example.fulfillment.domain.model.Order;
import com.example.fulfillment.domain.model.OrderHistoryEntry;
import com.example.fulfillment.infrastructure.persistence.entity.OrderEntity;
import com.example.fulfillment.infrastructure.persistence.mapper.OrderPersistenceMapper;
import com.example.fulfillment.infrastructure.persistence.repository.OrderHistoryRepository;
import com.example.fulfillment.infrastructure.persistence.repository.OrderJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * JPA backed order store. Orders and their history are written in the
 * caller's transaction.
 */
@Component
@Transactional
public class OrderPersistenceAdapter implements OrderRepositoryPort {

    private static final Logger log = LoggerFactory.getLogger(OrderPersistenceAdapter.class);

    private final OrderJpaRepository orderRepository;
    private final OrderHistoryRepository historyRepository;
    private final OrderPersistenceMapper mapper;

    public OrderPersistenceAdapter(
            OrderJpaRepository orderRepository,
            OrderHistoryRepository historyRepository,
            OrderPersistenceMapper mapper) {
        this.orderRepository = orderRepository;
        this.historyRepository = historyRepository;
        this.mapper = mapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Order> findById(Long orderId) {
        return orderRepository.findById(orderId).map(mapper::toDomain);
    }

    @Override
    public Optional<Order> findByIdForUpdate(Long orderId) {
        return orderRepository.findByIdForUpdate(orderId).map(mapper::toDomain);
    }

    @Override
    public Order save(Order order) {
        OrderEntity entity;
        if (order.getId() == null) {
            entity = mapper.toEntity(order);
        } else {
            entity = orderRepository.findById(order.getId())
                    .orElseThrow(() -> new OrderNotFoundException(order.getId()));
            mapper.updateEntity(order, entity);
        }
        OrderEntity saved = orderRepository.saveAndFlush(entity);
        log.debug("Saved order entity: {} (status {})", saved.getId(), saved.getStatus());
        return mapper.toDomain(saved);
    }

    @Override
    public void appendHistory(OrderHistoryEntry entry) {
        historyRepository.save(mapper.toHistoryEntity(entry));
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderHistoryEntry> findHistory(Long orderId) {
        return historyRepository.findByOrderIdOrderByCreatedAtAscIdAsc(orderId).stream()
                .map(mapper::toHistoryEntry)
                .toList();
    }
}
