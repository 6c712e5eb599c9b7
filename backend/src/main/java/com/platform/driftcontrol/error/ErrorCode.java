package com.platform.driftcontrol.error;

/**
 * Standardized error codes for the drift control service.
 * Each error has a unique code that clients can use to take specific actions.
 * 
 * Format: DC-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation and configuration errors
 * - 3xx: Resource errors (not found, conflict)
 * - 4xx: External process errors (terraform)
 * - 5xx: Remediation domain errors
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("DC-100", "Validation error", ErrorCategory.RECOVERABLE),
    INVALID_REQUEST("DC-101", "Invalid request format", ErrorCategory.RECOVERABLE),
    MISSING_REQUIRED_FIELD("DC-102", "Missing required field", ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("DC-103", "Invalid field value", ErrorCategory.RECOVERABLE),
    INVALID_CONFIGURATION("DC-110", "Invalid remediation configuration", ErrorCategory.RECOVERABLE),
    
    // ==================== Resource Errors (3xx) ====================
    
    RESOURCE_NOT_FOUND("DC-300", "Resource not found", ErrorCategory.RECOVERABLE),
    PLAN_NOT_FOUND("DC-301", "Remediation plan not found", ErrorCategory.RECOVERABLE),
    PLAN_ALREADY_EXECUTED("DC-310", "Remediation plan already executed", ErrorCategory.RECOVERABLE),
    
    // ==================== Process Errors (4xx) ====================
    
    PROCESS_FAILED("DC-400", "Infrastructure tool exited with an error", ErrorCategory.RECOVERABLE),
    PROCESS_UNAVAILABLE("DC-401", "Infrastructure tool could not be started", ErrorCategory.FATAL),
    PROCESS_TIMEOUT("DC-402", "Infrastructure tool timed out", ErrorCategory.RECOVERABLE),
    
    // ==================== Remediation Errors (5xx - Domain) ====================
    
    SOURCE_REWRITE_FAILED("DC-500", "Declarative source could not be rewritten", ErrorCategory.RECOVERABLE),
    ROLLBACK_UNAVAILABLE("DC-510", "No state backup available for rollback", ErrorCategory.RECOVERABLE),
    STATE_TRANSITION_INVALID("DC-520", "Invalid status transition", ErrorCategory.FATAL),
    
    // ==================== Internal Errors (9xx) ====================
    
    INTERNAL_ERROR("DC-900", "Internal server error", ErrorCategory.FATAL);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recoverable errors - client can retry or fix the request.
         */
        RECOVERABLE,
        
        /**
         * Fatal errors - the service or its environment needs intervention.
         */
        FATAL
    }
}
