package com.example.fulfillment.application.service;

import com.example.fulfillment.application.port.out.TaskQueuePort;
import com.example.fulfillment.application.port.out.TaskQueuePort.TaskType;
import com.example.fulfillment.domain.event.OrderEvent;
import com.example.fulfillment.domain.event.OrderEventBus;
import com.example.fulfillment.domain.event.OrderEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Connects order lifecycle events to loyalty tasks.
 * Each event enqueues exactly one task; guest orders never reach the ledger.
 */
@Component
public class LoyaltyEventHandlers {

    private static final Logger log = LoggerFactory.getLogger(LoyaltyEventHandlers.class);

    private final TaskQueuePort taskQueue;

    public LoyaltyEventHandlers(TaskQueuePort taskQueue) {
        this.taskQueue = taskQueue;
    }

    public void registerOn(OrderEventBus eventBus) {
        eventBus.subscribe(OrderEventType.ORDER_COMPLETED, this::onOrderCompleted);
        eventBus.subscribe(OrderEventType.ORDER_CANCELED, this::onOrderReversed);
        eventBus.subscribe(OrderEventType.ORDER_REFUNDED, this::onOrderReversed);
        eventBus.subscribe(OrderEventType.ORDER_RETURNED, this::onOrderReversed);
    }

    void onOrderCompleted(OrderEvent event) {
        enqueue(event, TaskType.PROCESS_ORDER_POINTS);
    }

    void onOrderReversed(OrderEvent event) {
        enqueue(event, TaskType.REVERSE_ORDER_POINTS);
    }

    private void enqueue(OrderEvent event, TaskType taskType) {
        if (!event.hasUser()) {
            log.debug("Skipping {} for guest order {}", taskType, event.orderId());
            return;
        }
        String taskId = taskQueue.enqueue(taskType, event.orderId().toString());
        log.info("Queued {} task {} for order {} ({})",
                taskType, taskId, event.orderId(), event.type().getEventName());
    }
}
