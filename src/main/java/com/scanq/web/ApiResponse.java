package com.scanq.web;

import java.util.Map;

/**
 * Success envelope {@code {success: true, data: ...}}; failures use
 * {@link com.scanq.error.ErrorResponse}.
 */
public record ApiResponse<T>(boolean success, T data) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data);
    }

    public static ApiResponse<Map<String, String>> message(String message) {
        return ok(Map.of("message", message));
    }
}
