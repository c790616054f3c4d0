package com.cred.freestyle.pos.api.exception;

import com.cred.freestyle.pos.api.dto.ErrorResponse;
import com.cred.freestyle.pos.exception.DuplicateReceiptException;
import com.cred.freestyle.pos.exception.InsufficientStockException;
import com.cred.freestyle.pos.exception.InvalidOrderStateException;
import com.cred.freestyle.pos.exception.ResourceNotFoundException;
import com.cred.freestyle.pos.infrastructure.metrics.PosMetricsService;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for the POS API.
 * Converts domain and infrastructure failures into {@link ErrorResponse} bodies.
 *
 * Status mapping:
 * - 400: invalid input, invalid order state
 * - 404: unknown order, item or user
 * - 409: insufficient stock, duplicate receipt, lock wait timeout (retryable)
 * - 503: database unavailable (retryable)
 *
 * @author POS Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final PosMetricsService metricsService;

    public GlobalExceptionHandler(PosMetricsService metricsService) {
        this.metricsService = metricsService;
    }

    /**
     * Returns 409 CONFLICT when stock does not cover a line.
     */
    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientStockException(
            InsufficientStockException ex,
            HttpServletRequest request
    ) {
        logger.warn("Insufficient stock: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.CONFLICT, "Insufficient Stock",
                ex.getMessage(), request.getRequestURI())
                .addDetail("itemId", ex.getItemId())
                .addDetail("requestedQuantity", ex.getRequestedQuantity())
                .addDetail("availableQuantity", ex.getAvailableQuantity());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Returns 409 CONFLICT when the receipt number belongs to another order.
     */
    @ExceptionHandler(DuplicateReceiptException.class)
    public ResponseEntity<ErrorResponse> handleDuplicateReceiptException(
            DuplicateReceiptException ex,
            HttpServletRequest request
    ) {
        logger.warn("Duplicate receipt: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.CONFLICT, "Duplicate Receipt",
                ex.getMessage(), request.getRequestURI())
                .addDetail("receiptNumber", ex.getReceiptNumber())
                .addDetail("orderId", ex.getOrderId());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Unique constraint violations that escaped the service checks.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrityViolationException(
            DataIntegrityViolationException ex,
            HttpServletRequest request
    ) {
        logger.warn("Data integrity violation: {}", ex.getMostSpecificCause().getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.CONFLICT, "Conflict",
                "The request conflicts with existing data.", request.getRequestURI());

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Resource not found: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.NOT_FOUND, "Resource Not Found",
                ex.getMessage(), request.getRequestURI())
                .addDetail("resourceType", ex.getResourceType())
                .addDetail("resourceId", ex.getResourceId());

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    /**
     * Returns 400 BAD REQUEST when an operation does not apply to the order.
     */
    @ExceptionHandler(InvalidOrderStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidOrderStateException(
            InvalidOrderStateException ex,
            HttpServletRequest request
    ) {
        logger.warn("Invalid order state: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.BAD_REQUEST, "Invalid Order State",
                ex.getMessage(), request.getRequestURI())
                .addDetail("orderId", ex.getOrderId());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Returns 409 CONFLICT when a row lock could not be acquired in time.
     * Nothing was changed, so the caller may repeat the request.
     */
    @ExceptionHandler(PessimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handlePessimisticLockingFailureException(
            PessimisticLockingFailureException ex,
            HttpServletRequest request
    ) {
        logger.warn("Lock conflict on {}: {}", request.getRequestURI(), ex.getMessage());
        metricsService.recordLockConflict(request.getMethod() + " " + request.getRequestURI());

        ErrorResponse error = ErrorResponse.of(HttpStatus.CONFLICT, "Lock Conflict",
                "The order or its items are being updated by another request. Please retry.",
                request.getRequestURI())
                .markRetryable();

        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(DataAccessResourceFailureException.class)
    public ResponseEntity<ErrorResponse> handleDataAccessResourceFailureException(
            DataAccessResourceFailureException ex,
            HttpServletRequest request
    ) {
        logger.error("Database unavailable: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable",
                "The data store is temporarily unavailable. Please retry.", request.getRequestURI())
                .markRetryable();

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalStateException(
            IllegalStateException ex,
            HttpServletRequest request
    ) {
        logger.warn("Illegal state: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.BAD_REQUEST, "Invalid Request",
                ex.getMessage(), request.getRequestURI());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
            IllegalArgumentException ex,
            HttpServletRequest request
    ) {
        logger.warn("Illegal argument: {}", ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.BAD_REQUEST, "Invalid Argument",
                ex.getMessage(), request.getRequestURI());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Returns 400 BAD REQUEST with field-level validation errors.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation failed: {} field errors", ex.getBindingResult().getFieldErrorCount());

        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError error : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.putIfAbsent(error.getField(), error.getDefaultMessage());
        }

        ErrorResponse error = ErrorResponse.of(HttpStatus.BAD_REQUEST, "Validation Failed",
                "Request validation failed. Please check the field errors.", request.getRequestURI())
                .addDetail("fieldErrors", fieldErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.warn("Malformed request to {}: {}", request.getRequestURI(), ex.getMessage());

        ErrorResponse error = ErrorResponse.of(HttpStatus.BAD_REQUEST, "Malformed Request",
                "Request body or parameters could not be read.", request.getRequestURI());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleAuthenticationException(
            AuthenticationException ex,
            HttpServletRequest request
    ) {
        ErrorResponse error = ErrorResponse.of(HttpStatus.UNAUTHORIZED, "Unauthorized",
                "Authentication is required.", request.getRequestURI());

        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(error);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDeniedException(
            AccessDeniedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Access denied to {}", request.getRequestURI());

        ErrorResponse error = ErrorResponse.of(HttpStatus.FORBIDDEN, "Forbidden",
                ex.getMessage(), request.getRequestURI());

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(error);
    }

    /**
     * Returns 500 INTERNAL SERVER ERROR for everything else.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unexpected error: ", ex);

        ErrorResponse error = ErrorResponse.of(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again later.", request.getRequestURI());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
