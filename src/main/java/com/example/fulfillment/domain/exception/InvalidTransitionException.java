package com.example.fulfillment.domain.exception;

import com.example.fulfillment.domain.model.OrderStatus;

import java.util.Set;

/**
 * Exception thrown when an order status change is not allowed from its current status.
 */
public class InvalidTransitionException extends DomainException {

    private final OrderStatus currentStatus;
    private final OrderStatus requestedStatus;
    private final Set<OrderStatus> allowedStatuses;

    public InvalidTransitionException(OrderStatus currentStatus, OrderStatus requestedStatus,
                                      Set<OrderStatus> allowedStatuses) {
        super(String.format("Cannot transition order from %s to %s. Allowed: %s",
                currentStatus, requestedStatus, allowedStatuses));
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
        this.allowedStatuses = Set.copyOf(allowedStatuses);
    }

    public OrderStatus getCurrentStatus() {
        return currentStatus;
    }

    public OrderStatus getRequestedStatus() {
        return requestedStatus;
    }

    public Set<OrderStatus> getAllowedStatuses() {
        return allowedStatuses;
    }
}
