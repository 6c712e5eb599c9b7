package com.platform.driftcontrol.api;

import com.platform.driftcontrol.audit.AuditEntry;
import com.platform.driftcontrol.audit.RemediationAuditLog;
import com.platform.driftcontrol.audit.RemediationStatistics;
import com.platform.driftcontrol.config.RemediationConfig;
import com.platform.driftcontrol.error.ErrorCode;
import com.platform.driftcontrol.error.ResourceNotFoundException;
import com.platform.driftcontrol.remediation.RemediationEngine;
import com.platform.driftcontrol.remediation.RemediationPlan;
import com.platform.driftcontrol.remediation.RemediationResult;
import com.platform.driftcontrol.remediation.approval.ApprovalRequest;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API for remediation plans, approvals, configuration and the audit trail.
 */
@Slf4j
@RestController
@RequestMapping("/api/remediation")
@AllArgsConstructor
public class RemediationController {
    
    private final RemediationEngine engine;
    private final PlanRepository planRepository;
    private final RemediationAuditLog auditLog;
    
    /**
     * Build a plan from a scan's drift results. Nothing is executed.
     */
    @PostMapping("/plans")
    @ResponseStatus(HttpStatus.CREATED)
    public RemediationPlan createPlan(@Valid @RequestBody CreatePlanRequest request) {
        RemediationPlan plan = engine.createPlan(request.driftResults(), request.scanId());
        return planRepository.save(plan);
    }
    
    @GetMapping("/plans")
    public List<RemediationPlan> getPlans() {
        return planRepository.findAll();
    }
    
    @GetMapping("/plans/{planId}")
    public RemediationPlan getPlan(@PathVariable String planId) {
        return requirePlan(planId);
    }
    
    /**
     * Execute a pending plan synchronously with the active configuration.
     */
    @PostMapping("/plans/{planId}/execute")
    public ExecutionResponse executePlan(@PathVariable String planId) {
        RemediationPlan plan = requirePlan(planId);
        log.info("Executing plan {} via API", planId);
        
        List<RemediationResult> results = engine.executePlan(plan);
        planRepository.saveResults(planId, results);
        return new ExecutionResponse(plan, results);
    }
    
    @GetMapping("/plans/{planId}/results")
    public List<RemediationResult> getResults(@PathVariable String planId) {
        requirePlan(planId);
        return planRepository.findResults(planId).orElse(List.of());
    }
    
    @GetMapping("/approvals")
    public List<ApprovalRequest> getPendingApprovals() {
        return engine.getPendingApprovals();
    }
    
    /**
     * Record sign-off for an action that was held for approval.
     */
    @PostMapping("/approvals/{actionId}/approve")
    public Map<String, Object> approveAction(@PathVariable String actionId, @RequestParam String approver) {
        if (!engine.approveAction(actionId, approver)) {
            throw new ResourceNotFoundException(ErrorCode.RESOURCE_NOT_FOUND, "ApprovalRequest", actionId);
        }
        return Map.of("actionId", actionId, "approved", true, "approvedBy", approver);
    }
    
    @GetMapping("/config")
    public RemediationConfig getConfig() {
        return engine.getConfig();
    }
    
    @PutMapping("/config")
    public RemediationConfig updateConfig(@RequestBody RemediationConfig config) {
        return engine.updateConfig(config);
    }
    
    /**
     * Audit entries, optionally narrowed to one plan or one action.
     */
    @GetMapping("/audit")
    public List<AuditEntry> getAuditLog(@RequestParam(required = false) String planId,
                                        @RequestParam(required = false) String actionId) {
        if (actionId != null) {
            return auditLog.getLogsByAction(actionId);
        }
        if (planId != null) {
            return auditLog.getLogsByPlan(planId);
        }
        return auditLog.getLogs();
    }
    
    @GetMapping("/audit/statistics")
    public RemediationStatistics getStatistics() {
        return auditLog.getStatistics();
    }
    
    private RemediationPlan requirePlan(String planId) {
        return planRepository.findById(planId)
            .orElseThrow(() -> ResourceNotFoundException.plan(planId));
    }
}
