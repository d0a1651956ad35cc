package com.example.fulfillment.infrastructure.config;

import com.example.fulfillment.application.service.LoyaltyEventHandlers;
import com.example.fulfillment.domain.event.OrderEventBus;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the order event bus and its subscribers.
 */
@Configuration
public class EventBusConfig {

    @Bean
    public OrderEventBus orderEventBus(LoyaltyEventHandlers loyaltyEventHandlers) {
        OrderEventBus eventBus = new OrderEventBus();
        loyaltyEventHandlers.registerOn(eventBus);
        return eventBus;
    }
}
