package com.example.fulfillment.infrastructure.adapter.in.web.dto;

import java.math.BigDecimal;

public record RefundResponse(
        Long orderId,
        Long itemId,
        int quantity,
        BigDecimal refundedAmount,
        String currency
) {}
