package com.platform.driftcontrol.observability;

import com.platform.driftcontrol.remediation.RemediationAction;
import com.platform.driftcontrol.remediation.RemediationPlan;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central registry for remediation metrics.
 */
@Slf4j
public class RemediationMetrics {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    
    public RemediationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }
    
    /**
     * Record a plan built from a scan.
     */
    public void recordPlanCreated(RemediationPlan plan) {
        incrementCounter("driftcontrol.plans.created", "dry_run", String.valueOf(plan.isDryRun()));
        for (RemediationAction action : plan.getActions()) {
            incrementCounter("driftcontrol.actions.planned",
                "severity", action.getSeverity().name(),
                "strategy", action.getStrategy().name());
        }
    }
    
    /**
     * Record the terminal status of a plan.
     */
    public void recordPlanCompleted(RemediationPlan plan) {
        incrementCounter("driftcontrol.plans.completed", "status", plan.getStatus().name());
    }
    
    /**
     * Record a finished action attempt.
     */
    public void recordActionOutcome(RemediationAction action, boolean success, long durationMs) {
        String key = "action." + action.getSeverity() + "." + action.getStrategy();
        Timer timer = timers.computeIfAbsent(key, k ->
            Timer.builder("driftcontrol.action.duration")
                .tag("severity", action.getSeverity().name())
                .tag("strategy", action.getStrategy().name())
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        timer.record(Duration.ofMillis(durationMs));
        
        incrementCounter("driftcontrol.actions.executed",
            "severity", action.getSeverity().name(),
            "success", String.valueOf(success));
    }
    
    /**
     * Record an action that never started because approval was denied.
     */
    public void recordApprovalDecision(RemediationAction action, boolean approved) {
        incrementCounter("driftcontrol.approvals",
            "severity", action.getSeverity().name(),
            "approved", String.valueOf(approved));
    }
    
    public void recordRollback(boolean success) {
        incrementCounter("driftcontrol.rollbacks", "success", String.valueOf(success));
    }
    
    /**
     * Record one infrastructure tool invocation.
     */
    public void recordProcessInvocation(String operation, int exitCode, long durationMs) {
        String key = "process." + operation;
        Timer timer = timers.computeIfAbsent(key, k ->
            Timer.builder("driftcontrol.process.duration")
                .tag("operation", operation)
                .register(meterRegistry));
        timer.record(Duration.ofMillis(durationMs));
        
        incrementCounter("driftcontrol.process.invocations",
            "operation", operation,
            "exit", exitCode == 0 ? "ok" : "error");
        log.debug("Recorded {} invocation (exit {}, {}ms)", operation, exitCode, durationMs);
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
}
