package com.example.fulfillment.infrastructure.persistence.mapper;

import com.example.fulfillment.domain.model.Money;
import com.example.fulfillment.domain.model.Order;
import com.example.fulfillment.domain.model.OrderHistoryEntry;
import com.example.fulfillment.domain.model.OrderItem;
import com.example.fulfillment.domain.model.OrderStatus;
import com.example.fulfillment.infrastructure.persistence.entity.OrderEntity;
import com.example.fulfillment.infrastructure.persistence.entity.OrderHistoryEntity;
import com.example.fulfillment.infrastructure.persistence.entity.OrderItemEntity;
import com.example.fulfillment.infrastructure.persistence.entity.OrderStatusEnum;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Mapper between domain Order and persistence OrderEntity.
 */
@Component
public class OrderPersistenceMapper {

    public OrderEntity toEntity(Order order) {
        OrderEntity entity = new OrderEntity();
        entity.setUuid(order.getUuid());
        entity.setUserId(order.getUserId());
        entity.setCurrency(order.getCurrency());
        entity.setShippingPrice(order.getShippingPrice().getAmount());
        entity.setCreatedAt(order.getCreatedAt());
        copyState(order, entity);

        for (OrderItem item : order.getItems()) {
            entity.addItem(toItemEntity(item));
        }
        return entity;
    }

    /**
     * Copies the mutable state of the aggregate onto a managed entity. Existing
     * lines are matched by id, new lines are appended.
     */
    public void updateEntity(Order order, OrderEntity entity) {
        copyState(order, entity);

        Map<Long, OrderItemEntity> existing = entity.getItems().stream()
                .collect(Collectors.toMap(OrderItemEntity::getId, Function.identity()));
        for (OrderItem item : order.getItems()) {
            OrderItemEntity itemEntity = item.getId() == null ? null : existing.get(item.getId());
            if (itemEntity == null) {
                entity.addItem(toItemEntity(item));
            } else {
                itemEntity.setQuantity(item.getQuantity());
                itemEntity.setRefundedQuantity(item.getRefundedQuantity());
            }
        }
    }

    public Order toDomain(OrderEntity entity) {
        String currency = entity.getCurrency();
        List<OrderItem> items = entity.getItems().stream()
                .map(item -> toOrderItem(item, currency))
                .collect(Collectors.toList());

        return Order.reconstitute(
                entity.getId(),
                entity.getUuid(),
                entity.getUserId(),
                currency,
                items,
                Money.of(entity.getShippingPrice(), currency),
                Money.of(entity.getPaidAmount(), currency),
                toDomainStatus(entity.getStatus()),
                entity.getPaymentStatus(),
                entity.getTrackingNumber(),
                entity.getCarrier(),
                entity.getMetadata(),
                entity.isDeleted(),
                entity.getCreatedAt(),
                entity.getStatusUpdatedAt()
        );
    }

    public OrderHistoryEntity toHistoryEntity(OrderHistoryEntry entry) {
        OrderHistoryEntity entity = new OrderHistoryEntity();
        entity.setOrderId(entry.orderId());
        entity.setChangeType(entry.changeType().name());
        entity.setPreviousStatus(entry.previousStatus() == null ? null : toStatusEnum(entry.previousStatus()));
        entity.setNewStatus(entry.newStatus() == null ? null : toStatusEnum(entry.newStatus()));
        entity.setNote(entry.note());
        entity.setCreatedAt(entry.occurredAt());
        return entity;
    }

    public OrderHistoryEntry toHistoryEntry(OrderHistoryEntity entity) {
        return new OrderHistoryEntry(
                entity.getOrderId(),
                OrderHistoryEntry.ChangeType.valueOf(entity.getChangeType()),
                entity.getPreviousStatus() == null ? null : toDomainStatus(entity.getPreviousStatus()),
                entity.getNewStatus() == null ? null : toDomainStatus(entity.getNewStatus()),
                entity.getNote(),
                entity.getCreatedAt()
        );
    }

    private void copyState(Order order, OrderEntity entity) {
        entity.setStatus(toStatusEnum(order.getStatus()));
        entity.setPaymentStatus(order.getPaymentStatus());
        entity.setPaidAmount(order.getPaidAmount().getAmount());
        entity.setTrackingNumber(order.getTrackingNumber());
        entity.setCarrier(order.getCarrier());
        entity.setMetadata(new HashMap<>(order.getMetadata()));
        entity.setDeleted(order.isDeleted());
        entity.setStatusUpdatedAt(order.getStatusUpdatedAt());
    }

    private OrderItemEntity toItemEntity(OrderItem item) {
        OrderItemEntity itemEntity = new OrderItemEntity();
        itemEntity.setProductId(item.getProductId());
        itemEntity.setProductName(item.getProductName());
        itemEntity.setUnitPrice(item.getUnitPrice().getAmount());
        itemEntity.setQuantity(item.getQuantity());
        itemEntity.setRefundedQuantity(item.getRefundedQuantity());
        itemEntity.setOriginalQuantity(item.getOriginalQuantity());
        return itemEntity;
    }

    private OrderItem toOrderItem(OrderItemEntity entity, String currency) {
        return OrderItem.reconstitute(
                entity.getId(),
                entity.getProductId(),
                entity.getProductName(),
                Money.of(entity.getUnitPrice(), currency),
                entity.getQuantity(),
                entity.getRefundedQuantity(),
                entity.getOriginalQuantity()
        );
    }

    public OrderStatusEnum toStatusEnum(OrderStatus status) {
        return switch (status) {
            case PENDING -> OrderStatusEnum.PENDING;
            case PROCESSING -> OrderStatusEnum.PROCESSING;
            case SHIPPED -> OrderStatusEnum.SHIPPED;
            case DELIVERED -> OrderStatusEnum.DELIVERED;
            case COMPLETED -> OrderStatusEnum.COMPLETED;
            case CANCELED -> OrderStatusEnum.CANCELED;
            case RETURNED -> OrderStatusEnum.RETURNED;
            case REFUNDED -> OrderStatusEnum.REFUNDED;
        };
    }

    public OrderStatus toDomainStatus(OrderStatusEnum status) {
        return switch (status) {
            case PENDING -> OrderStatus.PENDING;
            case PROCESSING -> OrderStatus.PROCESSING;
            case SHIPPED -> OrderStatus.SHIPPED;
            case DELIVERED -> OrderStatus.DELIVERED;
            case COMPLETED -> OrderStatus.COMPLETED;
            case CANCELED -> OrderStatus.CANCELED;
            case RETURNED -> OrderStatus.RETURNED;
            case REFUNDED -> OrderStatus.REFUNDED;
        };
    }
}
