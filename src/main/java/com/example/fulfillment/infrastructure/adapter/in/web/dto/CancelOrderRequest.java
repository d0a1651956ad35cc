package com.example.fulfillment.infrastructure.adapter.in.web.dto;

public record CancelOrderRequest(String reason) {}
