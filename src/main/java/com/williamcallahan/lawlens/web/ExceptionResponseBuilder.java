package com.williamcallahan.lawlens.web;

import com.williamcallahan.lawlens.domain.errors.ApiErrorResponse;
import com.williamcallahan.lawlens.domain.errors.ApiResponse;
import com.williamcallahan.lawlens.domain.errors.ApiSuccessResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Builds the JSON status payloads shared by every controller.
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * Builds an error response with status and message.
     *
     * @param status HTTP status
     * @param message user-facing message
     * @return error response
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    /**
     * Builds an error response carrying diagnostic details.
     *
     * @param status HTTP status
     * @param message user-facing message
     * @param details diagnostic details, never a stack trace
     * @return error response
     */
    public ResponseEntity<ApiResponse> buildErrorResponse(HttpStatus status, String message, String details) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message, details));
    }

    public ResponseEntity<ApiResponse> buildSuccessResponse(String message) {
        return ResponseEntity.ok(ApiSuccessResponse.success(message));
    }

    /**
     * Describes an exception for logs, adding status and body when it came from an HTTP call.
     *
     * @param exception exception to describe
     * @return description, or null when no exception is provided
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        StringBuilder description = new StringBuilder(exception.getClass().getSimpleName());
        if (exception.getMessage() != null) {
            description.append(": ").append(exception.getMessage());
        }
        Throwable cause = exception;
        while (cause != null && !(cause instanceof WebClientResponseException)) {
            cause = cause.getCause();
        }
        if (cause instanceof WebClientResponseException responseException) {
            description.append(" [httpStatus=").append(responseException.getStatusCode().value())
                    .append(", body=").append(responseException.getResponseBodyAsString())
                    .append(']');
        }
        return description.toString();
    }
}
