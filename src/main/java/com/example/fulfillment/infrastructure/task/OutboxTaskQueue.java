package com.example.fulfillment.infrastructure.task;

import com.example.fulfillment.application.port.out.TaskQueuePort;
import com.example.fulfillment.infrastructure.persistence.entity.LoyaltyTaskEntity;
import com.example.fulfillment.infrastructure.persistence.entity.LoyaltyTaskStatus;
import com.example.fulfillment.infrastructure.persistence.repository.LoyaltyTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Queues loyalty tasks as outbox rows in the caller's transaction.
 */
@Component
public class OutboxTaskQueue implements TaskQueuePort {

    private static final Logger log = LoggerFactory.getLogger(OutboxTaskQueue.class);

    private final LoyaltyTaskRepository taskRepository;

    public OutboxTaskQueue(LoyaltyTaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }

    @Override
    @Transactional
    public String enqueue(TaskType type, String aggregateId) {
        LoyaltyTaskEntity task = new LoyaltyTaskEntity();
        task.setId(UUID.randomUUID().toString());
        task.setTaskType(type);
        task.setAggregateId(aggregateId);
        task.setStatus(LoyaltyTaskStatus.PENDING);

        taskRepository.save(task);
        log.debug("Saved loyalty task {} ({}, aggregate {})", task.getId(), type, aggregateId);
        return task.getId();
    }
}
