package com.platform.driftcontrol.config;

import com.platform.driftcontrol.error.ValidationException;
import com.platform.driftcontrol.remediation.RemediationSeverity;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * Process-wide remediation policy.
 * 
 * Immutable: the engine reads one snapshot per call and callers replace the whole
 * snapshot between calls via {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class RemediationConfig {
    
    /**
     * Preview only; never mutate infrastructure or source.
     */
    @Builder.Default
    boolean dryRun = true;
    
    /**
     * Skip the approval gate for every action.
     */
    @Builder.Default
    boolean autoApprove = false;
    
    /**
     * Severities that must pass the approval gate.
     */
    @Builder.Default
    Set<RemediationSeverity> requireApprovalFor = Set.of(
        RemediationSeverity.LOW_RISK,
        RemediationSeverity.MEDIUM_RISK,
        RemediationSeverity.HIGH_RISK,
        RemediationSeverity.CRITICAL
    );
    
    /**
     * Advisory expiry stamped on approval requests. Not enforced.
     */
    Duration approvalTimeout;
    
    /**
     * Upper bound on actions running at the same time. 1 runs the plan strictly sequentially.
     */
    @Builder.Default
    int maxConcurrent = 1;
    
    @Builder.Default
    boolean continueOnError = false;
    
    @Builder.Default
    boolean rollbackOnError = true;
    
    /**
     * Allow CRITICAL (deleting) actions into a plan.
     */
    @Builder.Default
    boolean destructiveActionsAllowed = false;
    
    @Builder.Default
    boolean backupBeforeChange = true;
    
    /**
     * Substrings; when set, only resources whose name contains one of them are remediated.
     */
    List<String> includeResources;
    
    /**
     * Substrings; resources whose name contains one of them are skipped.
     */
    List<String> excludeResources;
    
    /**
     * Keep at most this many actions per plan (the first ones in execution order). Null is unlimited.
     */
    Integer maxActionsPerRun;
    
    /**
     * Property path substrings that are fixed by rewriting source instead of applying.
     */
    @Builder.Default
    List<String> sourceRewritePatterns = List.of();
    
    public static RemediationConfig defaults() {
        return RemediationConfig.builder().build();
    }
    
    public boolean requiresApprovalFor(RemediationSeverity severity) {
        return requireApprovalFor != null && requireApprovalFor.contains(severity);
    }
    
    /**
     * Rejects configurations the engine cannot honour.
     *
     * @return this, for chaining
     * @throws ValidationException naming the offending field
     */
    public RemediationConfig validate() {
        if (maxConcurrent < 1) {
            throw new ValidationException("maxConcurrent", maxConcurrent, "must be at least 1");
        }
        if (maxActionsPerRun != null && maxActionsPerRun < 1) {
            throw new ValidationException("maxActionsPerRun", maxActionsPerRun, "must be at least 1 when set");
        }
        if (approvalTimeout != null && (approvalTimeout.isZero() || approvalTimeout.isNegative())) {
            throw new ValidationException("approvalTimeout", approvalTimeout, "must be positive when set");
        }
        validateFilter("includeResources", includeResources);
        validateFilter("excludeResources", excludeResources);
        validateFilter("sourceRewritePatterns", sourceRewritePatterns);
        return this;
    }
    
    private static void validateFilter(String field, List<String> patterns) {
        if (patterns == null) {
            return;
        }
        if (patterns.isEmpty() && !"sourceRewritePatterns".equals(field)) {
            throw new ValidationException(field, patterns, "must list at least one pattern when set");
        }
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                throw new ValidationException(field, patterns, "patterns must not be blank");
            }
        }
    }
}
