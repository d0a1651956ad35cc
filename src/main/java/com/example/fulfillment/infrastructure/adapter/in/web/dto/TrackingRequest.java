package com.example.fulfillment.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;

public record TrackingRequest(
        @NotBlank(message = "Tracking number is required")
        String trackingNumber,

        String carrier
) {}
