package com.platform.driftcontrol.remediation.approval;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.platform.driftcontrol.remediation.RemediationSeverity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A request for human sign-off on one action.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApprovalRequest {
    
    String actionId;
    
    String planId;
    
    String resourceName;
    
    RemediationSeverity severity;
    
    String description;
    
    Instant requestedAt;
    
    /**
     * Advisory only; nothing expires requests automatically.
     */
    Instant expiresAt;
    
    String requester;
    
    boolean approved;
    
    String approvedBy;
    
    Instant approvedAt;
    
    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }
}
