package com.platform.driftcontrol.remediation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * The unit of work correcting one drifted property on one resource.
 * Status, timestamps, error and rollback data are mutated in place by the executor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemediationAction {
    
    /**
     * Unique action ID within its plan.
     */
    @Builder.Default
    private String id = UUID.randomUUID().toString();
    
    /**
     * ID of the drifted resource this action was derived from.
     */
    private String driftId;
    
    private String resourceName;
    
    /**
     * Coarse resource family inferred from the name (compute, storage, network, database, security).
     */
    private String resourceType;
    
    private String propertyPath;
    
    private RemediationStrategy strategy;
    
    private RemediationSeverity severity;
    
    /**
     * Value observed in the cloud.
     */
    private Object currentValue;
    
    /**
     * Value declared in source.
     */
    private Object desiredValue;
    
    private String description;
    
    private boolean requiresApproval;
    
    @Builder.Default
    private RemediationStatus status = RemediationStatus.PENDING;
    
    private Instant createdAt;
    
    private Instant executedAt;
    
    private Instant completedAt;
    
    private String error;
    
    /**
     * Set only after a successful pre-change state backup.
     */
    private RollbackData rollbackData;
    
    /**
     * Preview output captured in dry-run mode.
     */
    private String terraformPlan;
    
    /**
     * Snippet written by a source rewrite.
     */
    private String terraformCode;
}
