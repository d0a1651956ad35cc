package com.example.fulfillment.infrastructure.persistence.entity;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Audit row written for every stock mutation.
 */
@Entity
@Table(name = "stock_logs", indexes = {
    @Index(name = "idx_stock_logs_product", columnList = "product_id, created_at")
})
public class StockLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "operation", length = 16, nullable = false)
    @Enumerated(EnumType.STRING)
    private StockOperation operation;

    @Column(name = "quantity_delta", nullable = false)
    private int quantityDelta;

    @Column(name = "stock_after", nullable = false)
    private int stockAfter;

    @Column(name = "reason", length = 255)
    private String reason;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }

    public static StockLogEntity of(Long productId, Long orderId, StockOperation operation, int quantityDelta,
                                    int stockAfter, String reason) {
        StockLogEntity log = new StockLogEntity();
        log.productId = productId;
        log.orderId = orderId;
        log.operation = operation;
        log.quantityDelta = quantityDelta;
        log.stockAfter = stockAfter;
        log.reason = reason;
        return log;
    }

    public Long getId() {
        return id;
    }

    public Long getProductId() {
        return productId;
    }

    public Long getOrderId() {
        return orderId;
    }

    public StockOperation getOperation() {
        return operation;
    }

    public int getQuantityDelta() {
        return quantityDelta;
    }

    public int getStockAfter() {
        return stockAfter;
    }

    public String getReason() {
        return reason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
