package com.example.fulfillment.application.dto;

import com.example.fulfillment.domain.model.Order;
import com.example.fulfillment.domain.model.OrderItem;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read model of an order returned by the lifecycle use cases.
 */
public record OrderView(
        Long id,
        UUID uuid,
        Long userId,
        String status,
        String paymentStatus,
        String currency,
        BigDecimal itemsTotal,
        BigDecimal shippingPrice,
        BigDecimal paidAmount,
        String trackingNumber,
        String carrier,
        Map<String, Object> metadata,
        List<ItemView> items,
        Instant createdAt,
        Instant statusUpdatedAt
) {
    public static OrderView from(Order order) {
        return new OrderView(
                order.getId(),
                order.getUuid(),
                order.getUserId(),
                order.getStatus().name(),
                order.getPaymentStatus().name(),
                order.getCurrency(),
                order.getItemsTotal().getAmount(),
                order.getShippingPrice().getAmount(),
                order.getPaidAmount().getAmount(),
                order.getTrackingNumber(),
                order.getCarrier(),
                order.getMetadata(),
                order.getItems().stream().map(ItemView::from).toList(),
                order.getCreatedAt(),
                order.getStatusUpdatedAt()
        );
    }

    public record ItemView(
            Long id,
            Long productId,
            String productName,
            BigDecimal unitPrice,
            int quantity,
            int refundedQuantity,
            int originalQuantity
    ) {
        static ItemView from(OrderItem item) {
            return new ItemView(
                    item.getId(),
                    item.getProductId(),
                    item.getProductName(),
                    item.getUnitPrice().getAmount(),
                    item.getQuantity(),
                    item.getRefundedQuantity(),
                    item.getOriginalQuantity()
            );
        }
    }
}
