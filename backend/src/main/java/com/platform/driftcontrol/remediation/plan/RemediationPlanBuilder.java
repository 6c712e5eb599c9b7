package com.platform.driftcontrol.remediation.plan;

import com.platform.driftcontrol.audit.RemediationAuditLog;
import com.platform.driftcontrol.config.RemediationConfig;
import com.platform.driftcontrol.drift.DriftResult;
import com.platform.driftcontrol.drift.DriftedProperty;
import com.platform.driftcontrol.error.ValidationException;
import com.platform.driftcontrol.observability.RemediationMetrics;
import com.platform.driftcontrol.remediation.RemediationAction;
import com.platform.driftcontrol.remediation.RemediationPlan;
import com.platform.driftcontrol.remediation.RemediationSeverity;
import com.platform.driftcontrol.remediation.RemediationStatus;
import com.platform.driftcontrol.remediation.classify.RemediationClassifier;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Turns the drift results of one scan into an ordered remediation plan.
 * 
 * Plan creation never touches live infrastructure: it only classifies, filters,
 * counts and orders. The only side effects are an audit entry and metrics.
 */
@Slf4j
public class RemediationPlanBuilder {
    
    private static final Comparator<RemediationAction> BY_SEVERITY =
        Comparator.comparingInt(a -> a.getSeverity().rank());
    
    private final RemediationAuditLog auditLog;
    private final RemediationMetrics metrics;
    private final Clock clock;
    
    public RemediationPlanBuilder(RemediationAuditLog auditLog, RemediationMetrics metrics, Clock clock) {
        this.auditLog = auditLog;
        this.metrics = metrics;
        this.clock = clock;
    }
    
    /**
     * Create a plan for the drifted resources of a scan.
     *
     * @throws ValidationException if the scan id is missing or the configuration is invalid
     */
    public RemediationPlan createPlan(List<DriftResult> driftResults, String scanId, RemediationConfig config) {
        if (scanId == null || scanId.isBlank()) {
            throw new ValidationException("scanId is required to create a remediation plan");
        }
        config.validate();
        
        RemediationClassifier classifier = new RemediationClassifier(config.getSourceRewritePatterns(), clock);
        List<RemediationAction> generated = generateActions(driftResults, classifier);
        List<RemediationAction> actions = filterActions(generated, config);
        List<String> executionOrder = executionOrder(actions);
        
        if (config.getMaxActionsPerRun() != null && executionOrder.size() > config.getMaxActionsPerRun()) {
            int dropped = executionOrder.size() - config.getMaxActionsPerRun();
            executionOrder = List.copyOf(executionOrder.subList(0, config.getMaxActionsPerRun()));
            Set<String> kept = new HashSet<>(executionOrder);
            actions = actions.stream().filter(a -> kept.contains(a.getId())).toList();
            log.warn("Plan for scan {} limited to {} actions, {} deferred to a later run",
                scanId, config.getMaxActionsPerRun(), dropped);
        }
        
        RemediationPlan plan = RemediationPlan.builder()
            .scanId(scanId)
            .createdAt(clock.instant())
            .actions(new ArrayList<>(actions))
            .totalActions(actions.size())
            .safeActions(count(actions, a -> a.getSeverity() == RemediationSeverity.SAFE))
            .requiresApproval(count(actions, a -> a.isRequiresApproval() && !config.isAutoApprove()))
            .criticalActions(count(actions, a -> a.getSeverity() == RemediationSeverity.CRITICAL))
            .dryRun(config.isDryRun())
            .autoApprove(config.isAutoApprove())
            .executionOrder(new ArrayList<>(executionOrder))
            .status(RemediationStatus.PENDING)
            .build();
        
        log.info("Created plan {} for scan {}: {} actions ({} generated, {} filtered out)",
            plan.getId(), scanId, plan.getTotalActions(), generated.size(), generated.size() - actions.size());
        auditLog.info(plan.getId(), "",
            String.format("Created remediation plan with %d actions", plan.getTotalActions()));
        metrics.recordPlanCreated(plan);
        
        return plan;
    }
    
    /**
     * Flatten every drifted property of every drifted resource through the classifier.
     */
    List<RemediationAction> generateActions(List<DriftResult> driftResults, RemediationClassifier classifier) {
        List<RemediationAction> actions = new ArrayList<>();
        if (driftResults == null) {
            return actions;
        }
        for (DriftResult drift : driftResults) {
            if (!drift.hasDrift()) {
                continue;
            }
            for (DriftedProperty property : drift.driftedProperties()) {
                classifier.createAction(drift, property).ifPresent(actions::add);
            }
        }
        return actions;
    }
    
    /**
     * Apply include/exclude resource filters and drop destructive actions unless allowed.
     */
    List<RemediationAction> filterActions(List<RemediationAction> actions, RemediationConfig config) {
        return actions.stream()
            .filter(a -> config.getIncludeResources() == null
                || matchesAny(a.getResourceName(), config.getIncludeResources()))
            .filter(a -> config.getExcludeResources() == null
                || !matchesAny(a.getResourceName(), config.getExcludeResources()))
            .filter(a -> config.isDestructiveActionsAllowed() || !a.getSeverity().isDestructive())
            .toList();
    }
    
    /**
     * Action IDs sorted by ascending severity. The sort is stable, so actions of equal
     * severity keep the order in which they were generated.
     */
    public static List<String> executionOrder(List<RemediationAction> actions) {
        List<RemediationAction> sorted = new ArrayList<>(actions);
        sorted.sort(BY_SEVERITY);
        return sorted.stream().map(RemediationAction::getId).toList();
    }
    
    private static boolean matchesAny(String resourceName, List<String> patterns) {
        String name = resourceName == null ? "" : resourceName;
        return patterns.stream().anyMatch(name::contains);
    }
    
    private static int count(List<RemediationAction> actions, Predicate<RemediationAction> predicate) {
        return (int) actions.stream().filter(predicate).count();
    }
}
