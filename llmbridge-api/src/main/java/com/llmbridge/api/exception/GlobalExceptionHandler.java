package com.llmbridge.api.exception;

import com.llmbridge.api.dto.response.ErrorResponse;
import com.llmbridge.common.exception.LlmBridgeException;
import com.llmbridge.common.exception.NonRetriableException;
import com.llmbridge.llm.provider.ProviderAdapter.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.time.Instant;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(
            MethodArgumentNotValidException ex,
            WebRequest request
    ) {
        StringBuilder errors = new StringBuilder();
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = error instanceof FieldError ? ((FieldError) error).getField() : error.getObjectName();
            errors.append(fieldName).append(": ").append(error.getDefaultMessage()).append("; ");
        });

        return build(HttpStatus.BAD_REQUEST, "Validation failed", errors.toString(), null, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            WebRequest request
    ) {
        return build(HttpStatus.BAD_REQUEST, "Malformed request body", ex.getMostSpecificCause().getMessage(), null, request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadArgument(
            IllegalArgumentException ex,
            WebRequest request
    ) {
        return build(HttpStatus.BAD_REQUEST, "Invalid request", ex.getMessage(), null, request);
    }

    /**
     * The provider rejected the call; retrying would not help. Upstream client errors are
     * reported as a bad gateway since the caller's own request was well-formed.
     */
    @ExceptionHandler(NonRetriableException.class)
    public ResponseEntity<ErrorResponse> handleNonRetriable(
            NonRetriableException ex,
            WebRequest request
    ) {
        ProviderException cause = providerCause(ex);
        log.warn("Provider rejected request: {}", ex.getMessage());
        return build(HttpStatus.BAD_GATEWAY, "Provider rejected the request", ex.getMessage(),
            cause != null ? cause.getProvider().getDisplayName() : null, request);
    }

    @ExceptionHandler(LlmBridgeException.class)
    public ResponseEntity<ErrorResponse> handleRetriesExhausted(
            LlmBridgeException ex,
            WebRequest request
    ) {
        ProviderException cause = providerCause(ex);
        log.error("Provider unavailable after retries: {}", ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Provider unavailable", ex.getMessage(),
            cause != null ? cause.getProvider().getDisplayName() : null, request);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleNotConfigured(
            IllegalStateException ex,
            WebRequest request
    ) {
        log.warn("Request could not be served: {}", ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Provider not configured", ex.getMessage(), null, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            WebRequest request
    ) {
        log.error("Unexpected error", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", ex.getMessage(), null, request);
    }

    private static ProviderException providerCause(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ProviderException) {
                return (ProviderException) current;
            }
            current = current.getCause();
        }
        return null;
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message,
                                                       String provider, WebRequest request) {
        ErrorResponse errorResponse = ErrorResponse.builder()
            .error(error)
            .message(message)
            .status(status.value())
            .provider(provider)
            .timestamp(Instant.now())
            .path(request.getDescription(false).replace("uri=", ""))
            .build();
        return ResponseEntity.status(status).body(errorResponse);
    }
}
