package com.platform.driftcontrol.remediation.approval;

import com.platform.driftcontrol.audit.RemediationAuditLog;
import com.platform.driftcontrol.config.RemediationConfig;
import com.platform.driftcontrol.remediation.RemediationAction;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default approval gate: registers a pending request and denies synchronously.
 * 
 * Severities outside {@code requireApprovalFor} pass without a request. An action that
 * was approved through {@link #approveAction} before it is asked about again is let through
 * once and its request is dropped. The oldest requests are evicted past the capacity.
 */
@Slf4j
public class PendingApprovalGate implements ApprovalGate {
    
    private static final String SYSTEM_REQUESTER = "system";
    
    static final int MAX_REQUESTS = 500;
    
    private final Map<String, ApprovalRequest> requests = new LinkedHashMap<>();
    private final RemediationAuditLog auditLog;
    private final Clock clock;
    private final int maxRequests;
    
    public PendingApprovalGate(RemediationAuditLog auditLog, Clock clock) {
        this(auditLog, clock, MAX_REQUESTS);
    }
    
    PendingApprovalGate(RemediationAuditLog auditLog, Clock clock, int maxRequests) {
        this.auditLog = auditLog;
        this.clock = clock;
        this.maxRequests = maxRequests;
    }
    
    @Override
    public synchronized boolean requestApproval(String planId, RemediationAction action, RemediationConfig config) {
        if (!config.requiresApprovalFor(action.getSeverity())) {
            auditLog.info(planId, action.getId(),
                String.format("Approval policy does not cover %s actions, proceeding", action.getSeverity()));
            return true;
        }
        
        ApprovalRequest existing = requests.get(action.getId());
        if (existing != null && existing.isApproved()) {
            requests.remove(action.getId());
            auditLog.info(planId, action.getId(),
                String.format("Using approval granted by %s", existing.getApprovedBy()));
            return true;
        }
        
        Instant now = clock.instant();
        ApprovalRequest request = ApprovalRequest.builder()
            .actionId(action.getId())
            .planId(planId)
            .resourceName(action.getResourceName())
            .severity(action.getSeverity())
            .description(action.getDescription())
            .requestedAt(now)
            .expiresAt(config.getApprovalTimeout() == null ? null : now.plus(config.getApprovalTimeout()))
            .requester(SYSTEM_REQUESTER)
            .build();
        requests.putIfAbsent(action.getId(), request);
        evictOldest();
        
        auditLog.info(planId, action.getId(),
            String.format("Approval required for %s action: %s", action.getSeverity(), action.getDescription()));
        
        // No interactive channel is wired into the run; unapproved requests are denied.
        return false;
    }
    
    @Override
    public synchronized boolean approveAction(String actionId, String approver) {
        ApprovalRequest updated = requests.computeIfPresent(actionId, (id, request) ->
            request.toBuilder()
                .approved(true)
                .approvedBy(approver)
                .approvedAt(clock.instant())
                .build());
        
        if (updated == null) {
            log.warn("No approval request registered for action {}", actionId);
            return false;
        }
        
        auditLog.info(updated.getPlanId(), actionId, String.format("Action approved by %s", approver));
        return true;
    }
    
    @Override
    public synchronized List<ApprovalRequest> getPendingApprovals() {
        return requests.values().stream()
            .filter(r -> !r.isApproved())
            .sorted(Comparator.comparing(ApprovalRequest::getRequestedAt))
            .toList();
    }
    
    private void evictOldest() {
        while (requests.size() > maxRequests) {
            String eldest = requests.keySet().iterator().next();
            requests.remove(eldest);
            log.debug("Evicted approval request for action {}", eldest);
        }
    }
}
