package com.fibrepay.adapter.in.web;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Envelope of every JSON response
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse(
        String status,
        String message,
        Object data,
        List<String> errors
) {
    public static ApiResponse success(Object data) {
        return new ApiResponse("success", null, data, null);
    }

    public static ApiResponse error(String message, List<String> errors) {
        return new ApiResponse("error", message, null, errors);
    }

    public static ApiResponse error(String message) {
        return new ApiResponse("error", message, null, null);
    }
}
