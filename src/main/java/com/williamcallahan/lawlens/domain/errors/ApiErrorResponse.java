package com.williamcallahan.lawlens.domain.errors;

import java.util.Objects;

/**
 * JSON error payload.
 *
 * @param status always "error"
 * @param message user-facing error message
 * @param details optional diagnostic details, never a stack trace
 */
public record ApiErrorResponse(String status, String message, String details) implements ApiResponse {
    private static final String STATUS_ERROR = "error";

    public ApiErrorResponse {
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(message, "Error message is required");
    }

    public static ApiErrorResponse error(String message) {
        return new ApiErrorResponse(STATUS_ERROR, message, null);
    }

    /**
     * Creates an error payload carrying diagnostic details.
     *
     * @param message user-facing error message
     * @param details diagnostic details such as field validation failures
     * @return error payload
     */
    public static ApiErrorResponse error(String message, String details) {
        return new ApiErrorResponse(STATUS_ERROR, message, details);
    }
}
