package com.example.fulfillment.application.port.in;

import com.example.fulfillment.application.dto.OrderView;
import com.example.fulfillment.application.dto.PlaceOrderCommand;

/**
 * Inbound port for placing orders.
 */
public interface PlaceOrderUseCase {

    /**
     * Reserves stock for every line, stores the order and optionally redeems points,
     * all in one transaction.
     *
     * @param command the checkout command
     * @return the stored order
     */
    OrderView placeOrder(PlaceOrderCommand command);
}
