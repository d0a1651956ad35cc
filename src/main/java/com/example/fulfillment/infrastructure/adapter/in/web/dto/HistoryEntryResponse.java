package com.example.fulfillment.infrastructure.adapter.in.web.dto;

import java.time.Instant;

public record HistoryEntryResponse(
        String changeType,
        String previousStatus,
        String newStatus,
        String note,
        Instant occurredAt
) {}
