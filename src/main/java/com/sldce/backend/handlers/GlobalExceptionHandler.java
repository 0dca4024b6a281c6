package com.sldce.backend.handlers;

import com.sldce.backend.dto.ApiResponse;
import com.sldce.backend.exceptions.BadRequestException;
import com.sldce.backend.exceptions.BusinessException;
import com.sldce.backend.exceptions.ConflictException;
import com.sldce.backend.exceptions.InvalidTransitionException;
import com.sldce.backend.exceptions.ResourceNotFoundException;
import com.sldce.backend.exceptions.UpstreamSignalException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private <T> ResponseEntity<ApiResponse<T>> buildResponse(
            HttpStatus status,
            String code,
            String message,
            List<String> errors
    ) {
        return ResponseEntity.status(status).body(ApiResponse.error(code, message, errors));
    }

    // 404
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotFound(ResourceNotFoundException ex) {
        return buildResponse(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), List.of(ex.getMessage()));
    }

    // 409, suggestion already reviewed
    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ApiResponse<Void>> handleInvalidTransition(InvalidTransitionException ex) {
        return buildResponse(HttpStatus.CONFLICT, "INVALID_TRANSITION", ex.getMessage(), List.of(ex.getMessage()));
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<ApiResponse<Void>> handleConflict(ConflictException ex) {
        return buildResponse(HttpStatus.CONFLICT, "CONFLICT", ex.getMessage(), List.of(ex.getMessage()));
    }

    // unique constraints that slipped past the row locks
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleDataIntegrity(DataIntegrityViolationException ex) {
        log.warn("Storage constraint violated: {}", ex.getMostSpecificCause().getMessage());
        String message = "Concurrent modification detected, retry the operation";
        return buildResponse(HttpStatus.CONFLICT, "CONFLICT", message, List.of(message));
    }

    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(BadRequestException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", ex.getMessage(), List.of(ex.getMessage()));
    }

    // 502, classifier or anomaly detector failed
    @ExceptionHandler(UpstreamSignalException.class)
    public ResponseEntity<ApiResponse<Void>> handleUpstream(UpstreamSignalException ex) {
        log.warn("Signal provider failure: {}", ex.getMessage());
        return buildResponse(HttpStatus.BAD_GATEWAY, "UPSTREAM_SIGNAL_ERROR", ex.getMessage(), List.of(ex.getMessage()));
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ApiResponse<Void>> handleBusiness(BusinessException ex) {
        return buildResponse(HttpStatus.UNPROCESSABLE_ENTITY, "BUSINESS_RULE", ex.getMessage(), List.of(ex.getMessage()));
    }

    // 400 - bean validation (@Valid)
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(MethodArgumentNotValidException ex) {
        List<String> errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(err -> err.getField() + ": " + err.getDefaultMessage())
                .collect(Collectors.toList());

        return buildResponse(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Validation failed", errors);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ApiResponse<Void>> handleUnreadable(Exception ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Malformed request", List.of(ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Void>> handleIllegalArgument(IllegalArgumentException ex) {
        String msg = ex.getMessage();
        if (msg == null || msg.isBlank()) {
            msg = "Invalid request";
        }
        return buildResponse(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", msg, List.of(msg));
    }

    // 500
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGeneric(Exception ex) {
        log.error("Unexpected error", ex);
        return buildResponse(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "INTERNAL_ERROR",
                "Internal server error",
                List.of(ex.getClass().getSimpleName())
        );
    }
}
