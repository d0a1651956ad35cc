package com.example.fulfillment.infrastructure.task;

import com.example.fulfillment.application.dto.TaskResult;
import com.example.fulfillment.infrastructure.persistence.entity.LoyaltyTaskEntity;
import com.example.fulfillment.infrastructure.persistence.entity.LoyaltyTaskStatus;
import com.example.fulfillment.infrastructure.persistence.repository.LoyaltyTaskRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Polls pending loyalty tasks and runs them. A task ends either PROCESSED or
 * FAILED; failed tasks stay visible until they are requeued. A task left in
 * PROCESSING past its lease, for example by a restart mid-run, is put back
 * in the queue and runs again.
 */
@Component
@ConditionalOnProperty(value = "loyalty.tasks.worker.enabled", havingValue = "true", matchIfMissing = true)
public class LoyaltyTaskWorker {

    private static final Logger log = LoggerFactory.getLogger(LoyaltyTaskWorker.class);

    private final LoyaltyTaskRepository taskRepository;
    private final LoyaltyTasks tasks;
    private final ObjectMapper objectMapper;
    private final int batchSize;
    private final long retentionHours;
    private final long leaseSeconds;

    public LoyaltyTaskWorker(
            LoyaltyTaskRepository taskRepository,
            LoyaltyTasks tasks,
            ObjectMapper objectMapper,
            @Value("${loyalty.tasks.worker.batch-size:50}") int batchSize,
            @Value("${loyalty.tasks.worker.retention-hours:24}") long retentionHours,
            @Value("${loyalty.tasks.worker.lease-seconds:300}") long leaseSeconds) {
        this.taskRepository = taskRepository;
        this.tasks = tasks;
        this.objectMapper = objectMapper;
        this.batchSize = batchSize;
        this.retentionHours = retentionHours;
        this.leaseSeconds = leaseSeconds;
    }

    @Scheduled(fixedDelayString = "${loyalty.tasks.worker.interval-ms:1000}",
            initialDelayString = "${loyalty.tasks.worker.initial-delay-ms:1000}")
    public void pollAndProcess() {
        List<LoyaltyTaskEntity> pending = taskRepository.findPendingTasks(batchSize);

        if (!pending.isEmpty()) {
            log.debug("Processing {} pending loyalty tasks", pending.size());
        }

        for (LoyaltyTaskEntity task : pending) {
            process(task);
        }
    }

    /**
     * Requeues tasks stuck in PROCESSING longer than the lease.
     * The lease must exceed the longest retry sequence of a single task.
     */
    @Scheduled(fixedDelayString = "${loyalty.tasks.worker.reclaim-interval-ms:60000}",
            initialDelayString = "${loyalty.tasks.worker.initial-delay-ms:1000}")
    @Transactional
    public void reclaimStaleTasks() {
        Instant startedBefore = Instant.now().minus(leaseSeconds, ChronoUnit.SECONDS);
        int released = taskRepository.releaseStaleTasks(
                LoyaltyTaskStatus.PROCESSING, LoyaltyTaskStatus.PENDING, startedBefore);
        if (released > 0) {
            log.warn("Requeued {} loyalty tasks stuck in PROCESSING for more than {}s", released, leaseSeconds);
        }
    }

    /**
     * Removes processed tasks older than the retention window.
     */
    @Scheduled(fixedRate = 3600000)
    @Transactional
    public void cleanupProcessedTasks() {
        Instant cutoff = Instant.now().minus(retentionHours, ChronoUnit.HOURS);
        int deleted = taskRepository.deleteProcessedTasksBefore(cutoff);
        if (deleted > 0) {
            log.info("Cleaned up {} processed loyalty tasks older than {} hours", deleted, retentionHours);
        }
    }

    void process(LoyaltyTaskEntity task) {
        log.debug("Processing loyalty task: {} (type: {}, aggregate: {})",
                task.getId(), task.getTaskType(), task.getAggregateId());

        task.markProcessing();
        taskRepository.save(task);

        TaskResult result;
        try {
            result = dispatch(task);
        } catch (Exception e) {
            result = TaskResult.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }

        if (result.isSuccess()) {
            task.markProcessed(toJson(result));
            log.info("Loyalty task {} {} for {} processed: {}",
                    task.getId(), task.getTaskType(), task.getAggregateId(), result.data());
        } else {
            task.markFailed(result.reason(), toJson(result));
            log.error("Loyalty task {} {} for {} failed: {}",
                    task.getId(), task.getTaskType(), task.getAggregateId(), result.reason());
        }
        taskRepository.save(task);
    }

    private TaskResult dispatch(LoyaltyTaskEntity task) {
        return switch (task.getTaskType()) {
            case PROCESS_ORDER_POINTS -> tasks.processOrderPoints(Long.valueOf(task.getAggregateId()));
            case REVERSE_ORDER_POINTS -> tasks.reverseOrderPoints(Long.valueOf(task.getAggregateId()));
            case RECALCULATE_USER_TIER -> tasks.recalculateUserTier(Long.valueOf(task.getAggregateId()));
            case PROCESS_POINTS_EXPIRATION -> tasks.processPointsExpiration();
        };
    }

    private String toJson(TaskResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialize result of loyalty task: {}", e.getMessage());
            return null;
        }
    }
}
