package com.williamcallahan.lawlens.domain.errors;

/**
 * Shared contract for JSON status payloads returned by the HTTP surface.
 */
public sealed interface ApiResponse permits ApiErrorResponse, ApiSuccessResponse {

    /**
     * Returns the status indicator for this response.
     *
     * @return "error" or "success"
     */
    String status();
}
