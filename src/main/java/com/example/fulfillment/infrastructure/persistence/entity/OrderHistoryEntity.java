package com.example.fulfillment.infrastructure.persistence.entity;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Append-only audit row of order changes.
 */
@Entity
@Table(name = "order_history", indexes = {
    @Index(name = "idx_order_history_order", columnList = "order_id, created_at")
})
public class OrderHistoryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "order_id", nullable = false)
    private Long orderId;

    @Column(name = "change_type", length = 16, nullable = false)
    private String changeType;

    @Column(name = "previous_status", length = 32)
    @Enumerated(EnumType.STRING)
    private OrderStatusEnum previousStatus;

    @Column(name = "new_status", length = 32)
    @Enumerated(EnumType.STRING)
    private OrderStatusEnum newStatus;

    @Column(name = "note", length = 1000)
    private String note;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public Long getId() {
        return id;
    }

    public Long getOrderId() {
        return orderId;
    }

    public void setOrderId(Long orderId) {
        this.orderId = orderId;
    }

    public String getChangeType() {
        return changeType;
    }

    public void setChangeType(String changeType) {
        this.changeType = changeType;
    }

    public OrderStatusEnum getPreviousStatus() {
        return previousStatus;
    }

    public void setPreviousStatus(OrderStatusEnum previousStatus) {
        this.previousStatus = previousStatus;
    }

    public OrderStatusEnum getNewStatus() {
        return newStatus;
    }

    public void setNewStatus(OrderStatusEnum newStatus) {
        this.newStatus = newStatus;
    }

    public String getNote() {
        return note;
    }

    public void setNote(String note) {
        this.note = note;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
