package com.platform.driftcontrol.error;

import com.platform.driftcontrol.observability.RemediationMetrics;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Converts exceptions raised by the REST API to {@link ErrorResponse}.
 * 
 * RULES:
 * - Never return HTTP 200 on failure
 * - Always include the error code
 * - Fatal errors log at ERROR with stack trace, recoverable ones at WARN
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private final RemediationMetrics metrics;
    
    public GlobalExceptionHandler(RemediationMetrics metrics) {
        this.metrics = metrics;
    }
    
    @ExceptionHandler(DriftControlException.class)
    public ResponseEntity<ErrorResponse> handleDriftControlException(
            DriftControlException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);
        
        logError(ex, errorCode, traceId);
        recordMetric(errorCode);
        
        ErrorResponse.ErrorResponseBuilder builder = baseResponse(errorCode, ex.getMessage(), status, request, traceId);
        if (ex instanceof ProcessExecutionException pe) {
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("operation", pe.getOperation());
            metadata.put("exitCode", pe.getExitCode());
            builder.metadata(metadata).detail(pe.getStderr());
        }
        
        return ResponseEntity.status(status).body(builder.build());
    }
    
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Resource not found: {} ({})", traceId, ex.getResourceType(), ex.getResourceId());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = baseResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.NOT_FOUND, request, traceId)
            .metadata(Map.of(
                "resourceType", ex.getResourceType(),
                "resourceId", ex.getResourceId()
            ))
            .build();
        
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }
    
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            ValidationException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Validation error: {}", traceId, ex.getMessage());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse.ErrorResponseBuilder builder =
            baseResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.BAD_REQUEST, request, traceId);
        
        if (ex.getField() != null) {
            builder.fieldErrors(List.of(
                ErrorResponse.FieldError.builder()
                    .field(ex.getField())
                    .message(ex.getMessage())
                    .rejectedValue(ex.getRejectedValue())
                    .build()
            ));
        }
        
        return ResponseEntity.badRequest().body(builder.build());
    }
    
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult()
            .getFieldErrors()
            .stream()
            .map(fe -> ErrorResponse.FieldError.builder()
                .field(fe.getField())
                .message(fe.getDefaultMessage())
                .rejectedValue(fe.getRejectedValue())
                .build())
            .toList();
        
        log.warn("[{}] Validation failed: {} field errors", traceId, fieldErrors.size());
        recordMetric(ErrorCode.VALIDATION_ERROR);
        
        ErrorResponse response = baseResponse(ErrorCode.VALIDATION_ERROR, "Validation failed",
                HttpStatus.BAD_REQUEST, request, traceId)
            .fieldErrors(fieldErrors)
            .build();
        
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Invalid request body: {}", traceId, ex.getMessage());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        ErrorResponse response = baseResponse(ErrorCode.INVALID_REQUEST, "Invalid request body",
                HttpStatus.BAD_REQUEST, request, traceId)
            .detail(ex.getMostSpecificCause().getMessage())
            .build();
        
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Missing parameter: {}", traceId, ex.getParameterName());
        recordMetric(ErrorCode.MISSING_REQUIRED_FIELD);
        
        ErrorResponse response = baseResponse(ErrorCode.MISSING_REQUIRED_FIELD,
                "Missing required parameter: " + ex.getParameterName(), HttpStatus.BAD_REQUEST, request, traceId)
            .build();
        
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.warn("[{}] Type mismatch for parameter {}: {}", traceId, ex.getName(), ex.getValue());
        recordMetric(ErrorCode.INVALID_FIELD_VALUE);
        
        ErrorResponse response = baseResponse(ErrorCode.INVALID_FIELD_VALUE,
                "Invalid value for parameter: " + ex.getName(), HttpStatus.BAD_REQUEST, request, traceId)
            .build();
        
        return ResponseEntity.badRequest().body(response);
    }
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        
        String traceId = getOrCreateTraceId();
        
        log.error("[{}] FATAL: Unexpected error: {}", traceId, ex.getMessage(), ex);
        recordMetric(ErrorCode.INTERNAL_ERROR);
        
        ErrorResponse response = baseResponse(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred",
                HttpStatus.INTERNAL_SERVER_ERROR, request, traceId)
            .detail(ex.getClass().getSimpleName() + ": " + ex.getMessage())
            .build();
        
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
    
    // ==================== Helpers ====================
    
    private ErrorResponse.ErrorResponseBuilder baseResponse(ErrorCode errorCode, String message, HttpStatus status,
                                                            HttpServletRequest request, String traceId) {
        return ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(message)
            .fatal(errorCode.isFatal())
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .traceId(traceId);
    }
    
    private String getOrCreateTraceId() {
        String traceId = MDC.get("traceId");
        if (traceId == null) {
            traceId = UUID.randomUUID().toString().substring(0, 8);
            MDC.put("traceId", traceId);
        }
        return traceId;
    }
    
    private void logError(DriftControlException ex, ErrorCode errorCode, String traceId) {
        if (errorCode.isFatal()) {
            log.error("[{}] FATAL: {} - {}", traceId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", traceId, errorCode.getCode(), ex.getMessage());
        }
    }
    
    private void recordMetric(ErrorCode errorCode) {
        metrics.incrementCounter("driftcontrol.errors",
            "code", errorCode.getCode(),
            "fatal", String.valueOf(errorCode.isFatal()));
    }
    
    private HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case RESOURCE_NOT_FOUND, PLAN_NOT_FOUND ->
                HttpStatus.NOT_FOUND;
            case PLAN_ALREADY_EXECUTED, STATE_TRANSITION_INVALID ->
                HttpStatus.CONFLICT;
            case VALIDATION_ERROR, INVALID_REQUEST, MISSING_REQUIRED_FIELD, INVALID_FIELD_VALUE, INVALID_CONFIGURATION ->
                HttpStatus.BAD_REQUEST;
            case PROCESS_UNAVAILABLE ->
                HttpStatus.SERVICE_UNAVAILABLE;
            case PROCESS_TIMEOUT ->
                HttpStatus.GATEWAY_TIMEOUT;
            case PROCESS_FAILED, SOURCE_REWRITE_FAILED, ROLLBACK_UNAVAILABLE ->
                HttpStatus.UNPROCESSABLE_ENTITY;
            default ->
                HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
