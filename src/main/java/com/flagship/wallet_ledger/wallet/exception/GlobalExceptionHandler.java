package com.flagship.wallet_ledger.wallet.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flagship.wallet_ledger.ledger.ErrorKind;
import com.flagship.wallet_ledger.ledger.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps failures to HTTP responses with one body shape for every error.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedgerException(LedgerException e) {
        // already logged by the transfer engine with the account in context
        return ResponseEntity.status(statusFor(e.getKind())).body(bodyFor(e));
    }

    @ExceptionHandler(MissingIdentityException.class)
    public ResponseEntity<ErrorResponse> handleMissingIdentity(MissingIdentityException e) {
        log.warn("Request without caller identity: {}", e.getMessage());
        return error(HttpStatus.UNAUTHORIZED, "Unauthenticated", e.getMessage(), null);
    }

    @ExceptionHandler(AccountAccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(AccountAccessDeniedException e) {
        log.warn("Access denied: {}", e.getMessage());
        return error(HttpStatus.FORBIDDEN, "Forbidden", e.getMessage(), null);
    }

    @ExceptionHandler(IdempotencyConflictException.class)
    public ResponseEntity<ErrorResponse> handleIdempotencyConflict(IdempotencyConflictException e) {
        log.warn("Idempotency conflict for key {}: {}", e.getIdempotencyKey(), e.getMessage());
        return error(HttpStatus.CONFLICT, "Idempotency Conflict", e.getMessage(),
                Map.of("idempotency_key", e.getIdempotencyKey()));
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return error(HttpStatus.BAD_REQUEST, "Missing Required Header",
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return error(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception e) {
        log.warn("Unreadable request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid Request", "Request could not be read", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred", null);
    }

    public static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case INVALID_AMOUNT, SELF_TRANSFER_NOT_ALLOWED, INVALID_RECIPIENT -> HttpStatus.BAD_REQUEST;
            case INSUFFICIENT_FUNDS -> HttpStatus.UNPROCESSABLE_ENTITY;
            case TRANSIENT_STORE_ERROR -> HttpStatus.SERVICE_UNAVAILABLE;
            case LOG_WRITE_FAILED -> HttpStatus.INTERNAL_SERVER_ERROR;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
        };
    }

    /**
     * Error body for a ledger failure. The user-facing message comes from the
     * kind; the technical detail is not exposed.
     */
    public static ErrorResponse bodyFor(LedgerException e) {
        return ErrorResponse.builder()
            .error(statusFor(e.getKind()).getReasonPhrase())
            .kind(e.getKind().name())
            .message(e.getKind().getUserMessage())
            .retryable(e.isRetryable())
            .timestamp(Instant.now())
            .build();
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String error, String message,
                                                       Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
            .error(error)
            .message(message)
            .retryable(false)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }

    @lombok.Value
    @lombok.Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorResponse {
        String error;
        String kind;
        String message;
        boolean retryable;
        Map<String, String> details;
        Instant timestamp;
    }
}
