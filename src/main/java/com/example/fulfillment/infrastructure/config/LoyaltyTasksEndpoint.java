package com.example.fulfillment.infrastructure.config;

import com.example.fulfillment.infrastructure.persistence.entity.LoyaltyTaskEntity;
import com.example.fulfillment.infrastructure.persistence.entity.LoyaltyTaskStatus;
import com.example.fulfillment.infrastructure.persistence.repository.LoyaltyTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.WriteOperation;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Actuator endpoint listing failed loyalty tasks and putting them back in the queue.
 */
@Component
@Endpoint(id = "loyaltytasks")
public class LoyaltyTasksEndpoint {

    private static final Logger log = LoggerFactory.getLogger(LoyaltyTasksEndpoint.class);

    private final LoyaltyTaskRepository taskRepository;

    public LoyaltyTasksEndpoint(LoyaltyTaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }

    @ReadOperation
    public Map<String, Object> failedTasks() {
        List<Map<String, Object>> failed = taskRepository.findByStatus(LoyaltyTaskStatus.FAILED).stream()
                .map(LoyaltyTasksEndpoint::describe)
                .toList();
        return Map.of(
                "pending", taskRepository.findByStatus(LoyaltyTaskStatus.PENDING).size(),
                "failed", failed
        );
    }

    @WriteOperation
    @Transactional
    public Map<String, Object> requeue(String taskId) {
        return taskRepository.findById(taskId)
                .filter(task -> task.getStatus() == LoyaltyTaskStatus.FAILED)
                .map(task -> {
                    task.requeue();
                    taskRepository.save(task);
                    log.info("Requeued loyalty task {} ({})", task.getId(), task.getTaskType());
                    return Map.<String, Object>of("taskId", taskId, "status", task.getStatus().name());
                })
                .orElseGet(() -> Map.of("taskId", taskId, "status", "NOT_FAILED_OR_MISSING"));
    }

    private static Map<String, Object> describe(LoyaltyTaskEntity task) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", task.getId());
        view.put("type", task.getTaskType().name());
        view.put("aggregateId", task.getAggregateId());
        view.put("attempts", task.getAttempts());
        view.put("error", task.getErrorMessage());
        view.put("createdAt", String.valueOf(task.getCreatedAt()));
        view.put("processedAt", String.valueOf(task.getProcessedAt()));
        return view;
    }
}
