package com.flagship.leave_ledger.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the leave error taxonomy onto HTTP responses.
 *
 * <ul>
 *   <li>validation, insufficient balance, invalid state: 400</li>
 *   <li>authorization: 403</li>
 *   <li>unknown request or balance: 404</li>
 *   <li>overlap: 409</li>
 *   <li>concurrency conflict after retries: 503</li>
 * </ul>
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Header",
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing required parameter: {}", e.getParameterName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Parameter",
                "Required parameter '" + e.getParameterName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, String> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception e) {
        log.warn("Unreadable request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", "Request could not be parsed", null);
    }

    @ExceptionHandler(InsufficientBalanceException.class)
    public ResponseEntity<ApiError> handleInsufficientBalance(InsufficientBalanceException e) {
        log.warn("Insufficient balance: {}", e.getMessage());

        Map<String, String> details = new LinkedHashMap<>();
        details.put("balanceType", e.getKey().getBalanceType().name());
        details.put("year", String.valueOf(e.getKey().getYear()));
        details.put("remaining", e.getRemaining().toPlainString());
        details.put("requested", e.getRequested().toPlainString());

        return respond(HttpStatus.BAD_REQUEST, "Insufficient Balance", e.getMessage(), details);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ApiError> handleInvalidTransition(InvalidTransitionException e) {
        log.warn("Invalid transition from {}: {}", e.getCurrentStatus(), e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid State", e.getMessage(),
                Map.of("status", String.valueOf(e.getCurrentStatus())));
    }

    @ExceptionHandler(LeaveValidationException.class)
    public ResponseEntity<ApiError> handleLeaveValidation(LeaveValidationException e) {
        log.warn("Invalid leave request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(ApprovalAuthorizationException.class)
    public ResponseEntity<ApiError> handleAuthorization(ApprovalAuthorizationException e) {
        // Already logged as a security event where the decision was taken.
        return respond(HttpStatus.FORBIDDEN, "Forbidden", e.getMessage(), null);
    }

    @ExceptionHandler({LeaveRequestNotFoundException.class, BalanceNotFoundException.class})
    public ResponseEntity<ApiError> handleNotFound(RuntimeException e) {
        log.debug("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), null);
    }

    @ExceptionHandler(OverlapConflictException.class)
    public ResponseEntity<ApiError> handleOverlap(OverlapConflictException e) {
        log.warn("Overlap conflict: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Overlap Conflict", e.getMessage(),
                Map.of("conflictingRequestId", e.getConflictingRequestId().toString()));
    }

    @ExceptionHandler(ConcurrencyFailureException.class)
    public ResponseEntity<ApiError> handleConcurrencyConflict(ConcurrencyFailureException e) {
        log.warn("Concurrency conflict after retries: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Concurrency Conflict",
                "The resource is being modified concurrently, please retry", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred", null);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String error, String message,
                                             Map<String, String> details) {
        ApiError body = ApiError.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(body);
    }
}
