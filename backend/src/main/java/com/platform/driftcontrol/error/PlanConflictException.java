package com.platform.driftcontrol.error;

import com.platform.driftcontrol.remediation.RemediationStatus;

/**
 * Thrown when a plan is asked to execute but is no longer pending.
 */
public class PlanConflictException extends DriftControlException {
    
    private final String planId;
    private final RemediationStatus status;
    
    public PlanConflictException(String planId, RemediationStatus status) {
        super(ErrorCode.PLAN_ALREADY_EXECUTED,
            String.format("Plan %s cannot be executed from status %s", planId, status));
        this.planId = planId;
        this.status = status;
    }
    
    public String getPlanId() {
        return planId;
    }
    
    public RemediationStatus getStatus() {
        return status;
    }
}
