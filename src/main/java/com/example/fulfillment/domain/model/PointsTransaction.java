package com.example.fulfillment.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable row of the points ledger. Corrections are new offsetting rows,
 * which reference the row they offset through {@code sourceTransactionId}.
 */
public final class PointsTransaction {

    private final Long id;
    private final Long userId;
    private final int points;
    private final TransactionType type;
    private final Long orderId;
    private final String description;
    private final String createdBy;
    private final Long sourceTransactionId;
    private final Instant createdAt;

    private PointsTransaction(Long id, Long userId, int points, TransactionType type, Long orderId,
                              String description, String createdBy, Long sourceTransactionId, Instant createdAt) {
        this.id = id;
        this.userId = Objects.requireNonNull(userId, "UserId cannot be null");
        this.type = Objects.requireNonNull(type, "Type cannot be null");
        this.points = points;
        this.orderId = orderId;
        this.description = description;
        this.createdBy = createdBy;
        this.sourceTransactionId = sourceTransactionId;
        this.createdAt = createdAt;
    }

    public static PointsTransaction earn(Long userId, int points, Long orderId, String description) {
        requirePositive(points);
        return new PointsTransaction(null, userId, points, TransactionType.EARN, orderId, description,
                null, null, null);
    }

    public static PointsTransaction redeem(Long userId, int points, Long orderId, String description) {
        requirePositive(points);
        return new PointsTransaction(null, userId, -points, TransactionType.REDEEM, orderId, description,
                null, null, null);
    }

    /**
     * Offsets an EARN row; the amount may be clamped down to zero.
     */
    public static PointsTransaction expire(PointsTransaction earned, int amount) {
        return new PointsTransaction(null, earned.userId, -amount, TransactionType.EXPIRE, earned.orderId,
                "Points expired from transaction " + earned.id, null, earned.id, null);
    }

    /**
     * Reverses an EARN row; the amount may be clamped down to zero.
     */
    public static PointsTransaction reversal(PointsTransaction earned, int amount, String description) {
        return new PointsTransaction(null, earned.userId, -amount, TransactionType.ADJUST, earned.orderId,
                description, null, earned.id, null);
    }

    public static PointsTransaction bonus(Long userId, int points, Long orderId, String description) {
        requirePositive(points);
        return new PointsTransaction(null, userId, points, TransactionType.BONUS, orderId, description,
                null, null, null);
    }

    public static PointsTransaction reconstitute(Long id, Long userId, int points, TransactionType type, Long orderId,
                                                 String description, String createdBy, Long sourceTransactionId,
                                                 Instant createdAt) {
        return new PointsTransaction(id, userId, points, type, orderId, description, createdBy,
                sourceTransactionId, createdAt);
    }

    private static void requirePositive(int points) {
        if (points <= 0) {
            throw new IllegalArgumentException("Points must be positive: " + points);
        }
    }

    public Long getId() {
        return id;
    }

    public Long getUserId() {
        return userId;
    }

    public int getPoints() {
        return points;
    }

    public TransactionType getType() {
        return type;
    }

    public Long getOrderId() {
        return orderId;
    }

    public String getDescription() {
        return description;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public Long getSourceTransactionId() {
        return sourceTransactionId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "PointsTransaction{" +
                "id=" + id +
                ", userId=" + userId +
                ", type=" + type +
                ", points=" + points +
                ", orderId=" + orderId +
                '}';
    }
}
