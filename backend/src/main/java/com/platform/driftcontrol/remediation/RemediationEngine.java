package com.platform.driftcontrol.remediation;

import com.platform.driftcontrol.config.RemediationConfig;
import com.platform.driftcontrol.drift.DriftResult;
import com.platform.driftcontrol.remediation.approval.ApprovalGate;
import com.platform.driftcontrol.remediation.approval.ApprovalRequest;
import com.platform.driftcontrol.remediation.execution.RemediationExecutor;
import com.platform.driftcontrol.remediation.plan.RemediationPlanBuilder;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Entry point tying plan creation, approval and execution to one active configuration.
 * 
 * Each call reads the configuration once, so a concurrent {@link #updateConfig} never
 * changes policy halfway through a plan.
 */
@Slf4j
public class RemediationEngine {
    
    private final RemediationPlanBuilder planBuilder;
    private final RemediationExecutor executor;
    private final ApprovalGate approvalGate;
    private volatile RemediationConfig config;
    
    public RemediationEngine(RemediationPlanBuilder planBuilder, RemediationExecutor executor,
                             ApprovalGate approvalGate, RemediationConfig config) {
        this.planBuilder = planBuilder;
        this.executor = executor;
        this.approvalGate = approvalGate;
        this.config = config.validate();
        log.info("Remediation engine started (dry-run: {}, auto-approve: {}, max concurrent: {})",
            config.isDryRun(), config.isAutoApprove(), config.getMaxConcurrent());
    }
    
    public RemediationPlan createPlan(List<DriftResult> driftResults, String scanId) {
        return planBuilder.createPlan(driftResults, scanId, config);
    }
    
    /**
     * @throws com.platform.driftcontrol.error.PlanConflictException if the plan was already executed
     */
    public List<RemediationResult> executePlan(RemediationPlan plan) {
        return executor.executePlan(plan, config);
    }
    
    public boolean approveAction(String actionId, String approver) {
        return approvalGate.approveAction(actionId, approver);
    }
    
    public List<ApprovalRequest> getPendingApprovals() {
        return approvalGate.getPendingApprovals();
    }
    
    public RemediationConfig getConfig() {
        return config;
    }
    
    /**
     * Replace the active configuration. Invalid configurations are rejected and the previous one stays active.
     */
    public RemediationConfig updateConfig(RemediationConfig newConfig) {
        this.config = newConfig.validate();
        log.info("Remediation configuration updated (dry-run: {}, auto-approve: {}, max concurrent: {})",
            newConfig.isDryRun(), newConfig.isAutoApprove(), newConfig.getMaxConcurrent());
        return newConfig;
    }
}
