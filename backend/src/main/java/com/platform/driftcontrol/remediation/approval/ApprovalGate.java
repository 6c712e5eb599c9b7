package com.platform.driftcontrol.remediation.approval;

import com.platform.driftcontrol.config.RemediationConfig;
import com.platform.driftcontrol.remediation.RemediationAction;

import java.util.List;

/**
 * Checkpoint deciding whether an action that needs sign-off may run.
 * 
 * {@link #requestApproval} must resolve to a decision before the executor continues;
 * {@link #approveAction} records approvals arriving out of band (API, CLI).
 */
public interface ApprovalGate {
    
    /**
     * @return true if the action may run now
     */
    boolean requestApproval(String planId, RemediationAction action, RemediationConfig config);
    
    /**
     * Mark a previously requested action as approved.
     *
     * @return false if no request is registered for the action
     */
    boolean approveAction(String actionId, String approver);
    
    List<ApprovalRequest> getPendingApprovals();
}
