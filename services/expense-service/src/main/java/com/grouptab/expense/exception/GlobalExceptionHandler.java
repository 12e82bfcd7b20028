package com.grouptab.expense.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Global exception handler for the expense service
 * Provides consistent error responses across all endpoints
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Handle expense and participant not found exceptions
     */
    @ExceptionHandler({ExpenseNotFoundException.class, ParticipantNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(ExpenseException ex, HttpServletRequest request) {
        log.warn("Not found: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage(), null, request);
    }

    /**
     * Handle membership and ownership rejections
     */
    @ExceptionHandler({NotGroupMemberException.class, NotExpenseCreatorException.class})
    public ResponseEntity<ErrorResponse> handleForbidden(ExpenseException ex, HttpServletRequest request) {
        log.warn("Forbidden: {}", ex.getMessage());
        return build(HttpStatus.FORBIDDEN, ex.getErrorCode(), ex.getMessage(), null, request);
    }

    /**
     * Handle a split that was rescaled and must be confirmed by resubmitting it
     */
    @ExceptionHandler(SplitNeedsConfirmationException.class)
    public ResponseEntity<ErrorResponse> handleSplitNeedsConfirmation(
            SplitNeedsConfirmationException ex, HttpServletRequest request) {
        log.info("Split needs confirmation: {}", ex.getMessage());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("payerPercentages", ex.getPayerPercentages());
        metadata.put("owerPercentages", ex.getOwerPercentages());

        ErrorResponse error = baseError(HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage(), request)
                .details("Review the corrected percentages and submit them again")
                .metadata(metadata)
                .build();

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(InvalidPaymentStatusTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(
            InvalidPaymentStatusTransitionException ex, HttpServletRequest request) {
        log.warn("Invalid payment status transition: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage(),
                "Payment status can only move forward: pending, sent, completed", request);
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentModification(
            OptimisticLockingFailureException ex, HttpServletRequest request) {
        log.warn("Concurrent modification: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, "CONCURRENT_MODIFICATION",
                "The expense was changed by another request", "Reload the expense and try again", request);
    }

    @ExceptionHandler(MemberDirectoryUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleDirectoryUnavailable(
            MemberDirectoryUnavailableException ex, HttpServletRequest request) {
        log.error("Member directory unavailable: {}", ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, ex.getErrorCode(), ex.getMessage(),
                "Group membership could not be verified", request);
    }

    @ExceptionHandler(ExpenseValidationException.class)
    public ResponseEntity<ErrorResponse> handleExpenseValidation(
            ExpenseValidationException ex, HttpServletRequest request) {
        log.warn("Expense validation failed: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage(), null, request);
    }

    /**
     * Handle bean validation errors
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        log.warn("Validation error: {}", ex.getMessage());

        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(ErrorResponse.FieldError::of)
                .toList();

        ErrorResponse error = baseError(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Validation failed for request", request)
                .fieldErrors(fieldErrors)
                .build();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle malformed bodies, missing headers and unparseable path variables
     */
    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> handleInvalidRequest(Exception ex, HttpServletRequest request) {
        log.warn("Invalid request: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", "Invalid request", ex.getMessage(), request);
    }

    /**
     * Handle all other exceptions
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unhandled exception: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred",
                "Please contact support if the problem persists", request);
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String errorCode, String message,
                                                String details, HttpServletRequest request) {
        ErrorResponse error = baseError(status, errorCode, message, request)
                .details(details)
                .build();
        return ResponseEntity.status(status).body(error);
    }

    private ErrorResponse.ErrorResponseBuilder baseError(HttpStatus status, String errorCode, String message,
                                                         HttpServletRequest request) {
        return ErrorResponse.of(status, errorCode, message, request.getRequestURI());
    }
}
