package com.platform.driftcontrol.remediation;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one attempted action. Cancelled actions produce no result.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RemediationResult {
    
    String planId;
    
    RemediationAction action;
    
    boolean success;
    
    /**
     * Wall-clock duration in milliseconds.
     */
    long duration;
    
    String output;
    
    String error;
    
    boolean rollbackPerformed;
}
