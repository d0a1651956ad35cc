package com.example.fulfillment.application.dto;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured outcome of a loyalty task. An error result is a returned value,
 * never a thrown exception.
 */
public record TaskResult(
        String status,
        String reason,
        Map<String, Object> data
) {
    public static final String SUCCESS = "success";
    public static final String ERROR = "error";

    public static TaskResult success(Map<String, Object> data) {
        return new TaskResult(SUCCESS, null, new LinkedHashMap<>(data));
    }

    public static TaskResult error(String reason) {
        return new TaskResult(ERROR, reason, Map.of());
    }

    public static TaskResult error(String reason, Map<String, Object> data) {
        return new TaskResult(ERROR, reason, new LinkedHashMap<>(data));
    }

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }
}
