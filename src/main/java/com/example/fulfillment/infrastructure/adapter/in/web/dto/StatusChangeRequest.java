package com.example.fulfillment.infrastructure.adapter.in.web.dto;

import jakarta.validation.constraints.NotBlank;

public record StatusChangeRequest(
        @NotBlank(message = "Status is required")
        String status,

        String note
) {}
