package com.example.fulfillment.application.dto;

import com.example.fulfillment.domain.model.PointsTransaction;

import java.time.Instant;

public record LedgerEntryView(
        Long id,
        int points,
        String type,
        Long orderId,
        String description,
        Instant createdAt
) {
    public static LedgerEntryView from(PointsTransaction transaction) {
        return new LedgerEntryView(
                transaction.getId(),
                transaction.getPoints(),
                transaction.getType().name(),
                transaction.getOrderId(),
                transaction.getDescription(),
                transaction.getCreatedAt()
        );
    }
}
