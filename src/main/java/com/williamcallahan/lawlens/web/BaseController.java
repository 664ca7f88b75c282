package com.williamcallahan.lawlens.web;

import com.williamcallahan.lawlens.domain.errors.ApiResponse;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Base controller with the error mapping shared by all API controllers.
 *
 * <p>Invalid input maps to 400; anything unexpected maps to 500 with a generic message.</p>
 */
public abstract class BaseController {
    private static final Logger log = LoggerFactory.getLogger(BaseController.class);

    protected final ExceptionResponseBuilder exceptionBuilder;

    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    /**
     * Handles validation exceptions with bad request responses.
     *
     * @param validationException the validation exception
     * @return bad request error response
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse> handleValidationException(IllegalArgumentException validationException) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, validationException.getMessage());
    }

    /**
     * Handles bean validation failures on request bodies.
     *
     * @param invalidBody the binding failure
     * @return bad request error response listing the rejected fields
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse> handleInvalidBody(MethodArgumentNotValidException invalidBody) {
        String details = invalidBody.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + " " + fieldError.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Invalid request", details);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiResponse> handleInvalidParameter(HandlerMethodValidationException invalidParameter) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Invalid request", invalidParameter.getReason());
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ApiResponse> handleUnreadableRequest(Exception unreadable) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Malformed request");
    }

    /**
     * Handles unexpected failures without exposing internals.
     *
     * @param failure the exception that occurred
     * @return internal server error response
     */
    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ApiResponse> handleServiceException(RuntimeException failure) {
        log.error("Request failed: {}", exceptionBuilder.describeException(failure), failure);
        return exceptionBuilder.buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to process request");
    }

    protected ResponseEntity<ApiResponse> createSuccessResponse(String message) {
        return exceptionBuilder.buildSuccessResponse(message);
    }
}
