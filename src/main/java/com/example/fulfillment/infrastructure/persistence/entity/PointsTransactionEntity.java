package com.example.fulfillment.infrastructure.persistence.entity;

import com.example.fulfillment.domain.model.TransactionType;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * Append-only points ledger row. Columns are not updatable.
 */
@Entity
@Table(name = "points_transactions", indexes = {
    @Index(name = "idx_points_user_created", columnList = "user_id, created_at"),
    @Index(name = "idx_points_order_type", columnList = "order_id, transaction_type"),
    @Index(name = "idx_points_source", columnList = "source_transaction_id")
})
public class PointsTransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "points", nullable = false, updatable = false)
    private int points;

    @Column(name = "transaction_type", length = 16, nullable = false, updatable = false)
    @Enumerated(EnumType.STRING)
    private TransactionType transactionType;

    @Column(name = "order_id", updatable = false)
    private Long orderId;

    @Column(name = "description", length = 500, updatable = false)
    private String description;

    @Column(name = "created_by", length = 128, updatable = false)
    private String createdBy;

    @Column(name = "source_transaction_id", updatable = false)
    private Long sourceTransactionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public Long getId() {
        return id;
    }

    public Long getUserId() {
        return userId;
    }

    public void setUserId(Long userId) {
        this.userId = userId;
    }

    public int getPoints() {
        return points;
    }

    public void setPoints(int points) {
        this.points = points;
    }

    public TransactionType getTransactionType() {
        return transactionType;
    }

    public void setTransactionType(TransactionType transactionType) {
        this.transactionType = transactionType;
    }

    public Long getOrderId() {
        return orderId;
    }

    public void setOrderId(Long orderId) {
        this.orderId = orderId;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    public Long getSourceTransactionId() {
        return sourceTransactionId;
    }

    public void setSourceTransactionId(Long sourceTransactionId) {
        this.sourceTransactionId = sourceTransactionId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
