package com.example.fulfillment.application.port.in;

import com.example.fulfillment.application.dto.OrderView;
import com.example.fulfillment.domain.model.Money;
import com.example.fulfillment.domain.model.OrderHistoryEntry;
import com.example.fulfillment.domain.model.OrderStatus;

import java.util.List;

/**
 * Inbound port for status changes and post-checkout order edits.
 */
public interface OrderLifecycleUseCase {

    /**
     * Moves the order to a new status and runs the side effects of entering it.
     * Requesting the current status is a no-op.
     */
    OrderView changeStatus(Long orderId, OrderStatus target, String note);

    OrderView cancelOrder(Long orderId, String reason);

    OrderView markPaid(Long orderId);

    OrderView addTrackingInfo(Long orderId, String trackingNumber, String carrier);

    OrderView addItem(Long orderId, Long productId, int quantity);

    OrderView updateItemQuantity(Long orderId, Long itemId, int quantity);

    Money refundItem(Long orderId, Long itemId, int quantity);

    OrderView getOrder(Long orderId);

    List<OrderHistoryEntry> getHistory(Long orderId);

    void deleteOrder(Long orderId);
}
