package com.nosota.bankrec.exception;

import com.nosota.bankrec.api.response.ErrorResponse;
import com.nosota.bankrec.error.AlreadyFinalizedException;
import com.nosota.bankrec.error.ImmutableRecordException;
import com.nosota.bankrec.error.InvalidRequestException;
import com.nosota.bankrec.error.JournalEntryNotBalancedException;
import com.nosota.bankrec.error.NotBalancedException;
import com.nosota.bankrec.error.ReconciliationException;
import com.nosota.bankrec.error.UnbalancedSelectionException;
import jakarta.persistence.EntityNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts failures into {@link ErrorResponse} bodies.
 *
 * <p>Business-rule failures keep their error code and structured details. Anything else
 * is reported without internals, with the request correlation ID.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(
            InvalidRequestException ex, HttpServletRequest request) {
        return businessError(HttpStatus.BAD_REQUEST, "Validation Error", ex, request);
    }

    @ExceptionHandler(UnbalancedSelectionException.class)
    public ResponseEntity<ErrorResponse> handleUnbalancedSelection(
            UnbalancedSelectionException ex, HttpServletRequest request) {
        return businessError(HttpStatus.UNPROCESSABLE_ENTITY, "Unbalanced Selection", ex, request);
    }

    @ExceptionHandler(ImmutableRecordException.class)
    public ResponseEntity<ErrorResponse> handleImmutableRecord(
            ImmutableRecordException ex, HttpServletRequest request) {
        return businessError(HttpStatus.CONFLICT, "Immutable Record", ex, request);
    }

    @ExceptionHandler(NotBalancedException.class)
    public ResponseEntity<ErrorResponse> handleNotBalanced(
            NotBalancedException ex, HttpServletRequest request) {
        return businessError(HttpStatus.UNPROCESSABLE_ENTITY, "Not Balanced", ex, request);
    }

    @ExceptionHandler(AlreadyFinalizedException.class)
    public ResponseEntity<ErrorResponse> handleAlreadyFinalized(
            AlreadyFinalizedException ex, HttpServletRequest request) {
        return businessError(HttpStatus.CONFLICT, "Already Finalized", ex, request);
    }

    @ExceptionHandler(JournalEntryNotBalancedException.class)
    public ResponseEntity<ErrorResponse> handleJournalEntryNotBalanced(
            JournalEntryNotBalancedException ex, HttpServletRequest request) {
        return businessError(HttpStatus.UNPROCESSABLE_ENTITY, "Journal Entry Not Balanced", ex, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, Object> fields = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        log.warn("Request validation failed [correlationId={}]: {}", MDC.get("correlationId"), fields);

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Validation Error",
                "VALIDATION_ERROR",
                "Request validation failed",
                request.getRequestURI(),
                Map.of("fields", fields)
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler({
            ConstraintViolationException.class,
            HandlerMethodValidationException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(
            Exception ex, HttpServletRequest request) {
        log.warn("Bad request [correlationId={}]: {}", MDC.get("correlationId"), ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Validation Error",
                "VALIDATION_ERROR",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleEntityNotFound(
            EntityNotFoundException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Entity not found [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.NOT_FOUND.value(),
                "Not Found",
                "NOT_FOUND",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(
            IllegalStateException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Illegal state [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.CONFLICT.value(),
                "Invalid State",
                "INVALID_STATE",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(
            DataAccessException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Persistence error [correlationId={}]", correlationId, ex);

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.SERVICE_UNAVAILABLE.value(),
                "Persistence Error",
                "PERSISTENCE_ERROR",
                "Storage is unavailable. Retry later; correlation ID: " + correlationId,
                request.getRequestURI(),
                correlationId == null ? null : Map.<String, Object>of("correlationId", correlationId)
        );
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Unexpected error [correlationId={}]", correlationId, ex);

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error",
                "INTERNAL_ERROR",
                "An unexpected error occurred. Please contact support with correlation ID: " + correlationId,
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<ErrorResponse> businessError(HttpStatus status, String title,
                                                        ReconciliationException ex, HttpServletRequest request) {
        log.warn("{} [correlationId={}]: {}", title, MDC.get("correlationId"), ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                status.value(),
                title,
                ex.getErrorCode(),
                ex.getMessage(),
                request.getRequestURI(),
                ex.getDetails().isEmpty() ? null : ex.getDetails()
        );
        return ResponseEntity.status(status).body(error);
    }
}
