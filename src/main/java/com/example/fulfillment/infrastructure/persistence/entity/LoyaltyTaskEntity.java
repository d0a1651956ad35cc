package com.example.fulfillment.infrastructure.persistence.entity;

import com.example.fulfillment.application.port.out.TaskQueuePort.TaskType;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * Outbox row of a loyalty task. Written in the transaction of the order
 * change that produced it and consumed by the task worker.
 */
@Entity
@Table(name = "loyalty_tasks", indexes = {
    @Index(name = "idx_loyalty_tasks_status", columnList = "status"),
    @Index(name = "idx_loyalty_tasks_created_at", columnList = "created_at")
})
public class LoyaltyTaskEntity {

    @Id
    @Column(name = "id", length = 36)
    private String id;

    @Column(name = "task_type", length = 64, nullable = false)
    @Enumerated(EnumType.STRING)
    private TaskType taskType;

    @Column(name = "aggregate_id", length = 64, nullable = false)
    private String aggregateId;

    @Column(name = "status", length = 32)
    @Enumerated(EnumType.STRING)
    private LoyaltyTaskStatus status = LoyaltyTaskStatus.PENDING;

    @Column(name = "attempts")
    private Integer attempts = 0;

    @Column(name = "result", columnDefinition = "TEXT")
    private String result;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public TaskType getTaskType() {
        return taskType;
    }

    public void setTaskType(TaskType taskType) {
        this.taskType = taskType;
    }

    public String getAggregateId() {
        return aggregateId;
    }

    public void setAggregateId(String aggregateId) {
        this.aggregateId = aggregateId;
    }

    public LoyaltyTaskStatus getStatus() {
        return status;
    }

    public void setStatus(LoyaltyTaskStatus status) {
        this.status = status;
    }

    public Integer getAttempts() {
        return attempts;
    }

    public String getResult() {
        return result;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }

    public void markProcessing() {
        this.status = LoyaltyTaskStatus.PROCESSING;
        this.attempts++;
        this.startedAt = Instant.now();
    }

    public void markProcessed(String result) {
        this.status = LoyaltyTaskStatus.PROCESSED;
        this.result = result;
        this.errorMessage = null;
        this.processedAt = Instant.now();
    }

    public void markFailed(String error, String result) {
        this.status = LoyaltyTaskStatus.FAILED;
        this.errorMessage = error != null && error.length() > 1000 ? error.substring(0, 1000) : error;
        this.result = result;
        this.processedAt = Instant.now();
    }

    public void requeue() {
        this.status = LoyaltyTaskStatus.PENDING;
        this.errorMessage = null;
        this.startedAt = null;
        this.processedAt = null;
    }
}
