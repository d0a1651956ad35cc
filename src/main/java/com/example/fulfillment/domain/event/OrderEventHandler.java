package com.example.fulfillment.domain.event;

@FunctionalInterface
public interface OrderEventHandler {

    void handle(OrderEvent event);
}
