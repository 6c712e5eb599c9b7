package com.platform.driftcontrol.remediation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * An ordered batch of remediation actions for one scan, with aggregate risk statistics.
 * 
 * successCount + failureCount never exceeds totalActions; cancelled actions are only
 * reflected in cancelledCount.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemediationPlan {
    
    @Builder.Default
    private String id = UUID.randomUUID().toString();
    
    private String scanId;
    
    private Instant createdAt;
    
    @Builder.Default
    private List<RemediationAction> actions = new ArrayList<>();
    
    private int totalActions;
    
    /**
     * Actions classified SAFE.
     */
    private int safeActions;
    
    /**
     * Actions that will be sent to the approval gate (requiresApproval and not auto-approved).
     */
    private int requiresApproval;
    
    private int criticalActions;
    
    private boolean dryRun;
    
    private boolean autoApprove;
    
    /**
     * Action IDs in execution order (severity ascending, stable).
     */
    @Builder.Default
    private List<String> executionOrder = new ArrayList<>();
    
    @Builder.Default
    private RemediationStatus status = RemediationStatus.PENDING;
    
    private Instant startedAt;
    
    private Instant completedAt;
    
    private int successCount;
    
    private int failureCount;
    
    private int cancelledCount;
    
    public Optional<RemediationAction> findAction(String actionId) {
        return actions.stream()
            .filter(a -> a.getId().equals(actionId))
            .findFirst();
    }
}
