package com.platform.driftcontrol.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Error body returned by every API endpoint.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    
    /**
     * Stable error code (e.g., DC-301).
     */
    private String code;
    
    private String message;
    
    /**
     * Detailed description for debugging.
     */
    private String detail;
    
    /**
     * Whether the error needs operator intervention rather than a retry.
     */
    private boolean fatal;
    
    private int status;
    
    private Instant timestamp;
    
    private String path;
    
    /**
     * Correlates the response with log lines.
     */
    private String traceId;
    
    private List<FieldError> fieldErrors;
    
    private Map<String, Object> metadata;
    
    @Data
    @Builder
    public static class FieldError {
        private String field;
        private String message;
        private Object rejectedValue;
    }
}
