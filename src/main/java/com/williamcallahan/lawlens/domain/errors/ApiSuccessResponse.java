package com.williamcallahan.lawlens.domain.errors;

import java.util.Objects;

/**
 * JSON success payload for operations with no other result.
 *
 * @param status always "success"
 * @param message user-facing message
 */
public record ApiSuccessResponse(String status, String message) implements ApiResponse {
    private static final String STATUS_SUCCESS = "success";

    public ApiSuccessResponse {
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(message, "Success message is required");
    }

    public static ApiSuccessResponse success(String message) {
        return new ApiSuccessResponse(STATUS_SUCCESS, message);
    }
}
