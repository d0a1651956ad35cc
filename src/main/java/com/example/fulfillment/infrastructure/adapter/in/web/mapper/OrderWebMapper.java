package com.example.fulfillment.infrastructure.adapter.in.web.mapper;

import com.example.fulfillment.application.dto.PlaceOrderCommand;
import com.example.fulfillment.application.dto.PlaceOrderCommand.OrderLineDto;
import com.example.fulfillment.application.dto.RedeemPointsCommand;
import com.example.fulfillment.domain.model.Money;
import com.example.fulfillment.domain.model.OrderHistoryEntry;
import com.example.fulfillment.domain.model.OrderStatus;
import com.example.fulfillment.infrastructure.adapter.in.web.dto.HistoryEntryResponse;
import com.example.fulfillment.infrastructure.adapter.in.web.dto.PlaceOrderRequest;
import com.example.fulfillment.infrastructure.adapter.in.web.dto.RedeemPointsRequest;
import com.example.fulfillment.infrastructure.adapter.in.web.dto.RefundResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Mapper between web DTOs and application DTOs.
 */
@Component
public class OrderWebMapper {

    public PlaceOrderCommand toCommand(PlaceOrderRequest request) {
        List<OrderLineDto> items = request.items().stream()
                .map(item -> new OrderLineDto(item.productId(), item.quantity()))
                .toList();

        return new PlaceOrderCommand(
                request.userId(),
                request.currency(),
                request.shippingPrice(),
                items,
                request.loyaltyPointsToRedeem());
    }

    public RedeemPointsCommand toCommand(RedeemPointsRequest request) {
        return new RedeemPointsCommand(request.userId(), request.points(), request.currency(), request.orderId());
    }

    /**
     * @throws IllegalArgumentException for an unknown status name
     */
    public OrderStatus toStatus(String status) {
        try {
            return OrderStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown order status: " + status, e);
        }
    }

    public RefundResponse toRefundResponse(Long orderId, Long itemId, int quantity, Money refunded) {
        return new RefundResponse(orderId, itemId, quantity, refunded.getAmount(), refunded.getCurrency());
    }

    public HistoryEntryResponse toResponse(OrderHistoryEntry entry) {
        return new HistoryEntryResponse(
                entry.changeType().name(),
                entry.previousStatus() == null ? null : entry.previousStatus().name(),
                entry.newStatus() == null ? null : entry.newStatus().name(),
                entry.note(),
                entry.occurredAt());
    }
}
