package com.flagship.credit_ledger.exception;

import com.flagship.credit_ledger.observability.CorrelationContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps ledger failures to HTTP responses.
 *
 * Validation and insufficient balance are permanent (4xx, same request will fail again);
 * conflicts are retryable (409 with Retry-After); integrity failures are fatal (500).
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String RETRY_AFTER_SECONDS = "1";

    @ExceptionHandler(LedgerValidationException.class)
    public ResponseEntity<ApiError> handleValidation(LedgerValidationException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(error("Invalid Request", e.getMessage(), null, false));
    }

    @ExceptionHandler(InsufficientBalanceException.class)
    public ResponseEntity<ApiError> handleInsufficientBalance(InsufficientBalanceException e) {
        log.warn("Rejected spend: {}", e.getMessage());

        Map<String, String> details = new LinkedHashMap<>();
        details.put("asset_type", e.getAssetTypeCode());
        details.put("current_balance", e.getCurrentBalance().toPlainString());
        details.put("required_amount", e.getRequiredAmount().toPlainString());

        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(error("Insufficient Balance", e.getMessage(), details, false));
    }

    @ExceptionHandler(LedgerConflictException.class)
    public ResponseEntity<ApiError> handleConflict(LedgerConflictException e) {
        log.warn("Retryable conflict: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
            .body(error("Conflict", e.getMessage(), null, true));
    }

    @ExceptionHandler(TransactionNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(TransactionNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(error("Not Found", e.getMessage(), null, false));
    }

    @ExceptionHandler(LedgerIntegrityException.class)
    public ResponseEntity<ApiError> handleIntegrity(LedgerIntegrityException e) {
        log.error("Ledger integrity failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(error("Integrity Error", "The request could not be recorded consistently", null, false));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleBeanValidation(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                fieldError -> fieldError.getField(),
                fieldError -> fieldError.getDefaultMessage() != null ? fieldError.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing,
                LinkedHashMap::new
            ));

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(error("Validation Failed", "Request validation failed", errors, false));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(error("Malformed Request", "Request body is missing or is not valid JSON", null, false));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(error("Invalid Request", "Invalid value for parameter '" + e.getName() + "'", null, false));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiError> handleNoResource(NoResourceFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(error("Not Found", "No endpoint " + e.getHttpMethod() + " /" + e.getResourcePath(), null, false));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ApiError> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        HttpHeaders headers = new HttpHeaders();
        if (e.getSupportedHttpMethods() != null) {
            headers.setAllow(e.getSupportedHttpMethods());
        }
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
            .headers(headers)
            .body(error("Method Not Allowed", e.getMessage(), null, false));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(error("Internal Server Error", "An unexpected error occurred", null, false));
    }

    private static ApiError error(String error, String message, Map<String, String> details, boolean retryable) {
        return ApiError.builder()
            .error(error)
            .message(message)
            .details(details)
            .retryable(retryable)
            .timestamp(Instant.now())
            .correlationId(CorrelationContext.getCorrelationId())
            .build();
    }
}
