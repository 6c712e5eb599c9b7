package com.platform.driftcontrol.remediation.execution;

import com.platform.driftcontrol.audit.AuditLevel;
import com.platform.driftcontrol.audit.RemediationAuditLog;
import com.platform.driftcontrol.config.RemediationConfig;
import com.platform.driftcontrol.error.PlanConflictException;
import com.platform.driftcontrol.observability.RemediationMetrics;
import com.platform.driftcontrol.remediation.RemediationAction;
import com.platform.driftcontrol.remediation.RemediationPlan;
import com.platform.driftcontrol.remediation.RemediationResult;
import com.platform.driftcontrol.remediation.RemediationStatus;
import com.platform.driftcontrol.remediation.approval.ApprovalGate;
import com.platform.driftcontrol.remediation.process.ProcessRunner;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives a plan through its actions.
 * 
 * Actions start in the plan's execution order. Approvals are decided on the calling
 * thread; with {@code maxConcurrent > 1} admitted actions run on a bounded worker pool.
 * Per-action failures never escape: each becomes a failed {@link RemediationResult}.
 */
@Slf4j
public class RemediationExecutor {
    
    static final String MANUAL_OUTPUT = "Manual intervention required";
    
    private static final String MDC_PLAN_ID = "planId";
    private static final String MDC_ACTION_ID = "actionId";
    
    private final ProcessRunner processRunner;
    private final ApprovalGate approvalGate;
    private final ActionStateMachine stateMachine;
    private final RemediationAuditLog auditLog;
    private final RemediationMetrics metrics;
    private final Tracer tracer;
    private final Clock clock;
    
    public RemediationExecutor(ProcessRunner processRunner, ApprovalGate approvalGate,
                               ActionStateMachine stateMachine, RemediationAuditLog auditLog,
                               RemediationMetrics metrics, Tracer tracer, Clock clock) {
        this.processRunner = processRunner;
        this.approvalGate = approvalGate;
        this.stateMachine = stateMachine;
        this.auditLog = auditLog;
        this.metrics = metrics;
        this.tracer = tracer;
        this.clock = clock;
    }
    
    /**
     * Execute every action of a pending plan.
     *
     * @return one result per action that started, in completion-independent start order
     * @throws PlanConflictException if the plan is not pending
     */
    public List<RemediationResult> executePlan(RemediationPlan plan, RemediationConfig config) {
        synchronized (plan) {
            if (plan.getStatus() != RemediationStatus.PENDING) {
                throw new PlanConflictException(plan.getId(), plan.getStatus());
            }
            stateMachine.transition(plan, RemediationStatus.IN_PROGRESS);
        }
        
        MDC.put(MDC_PLAN_ID, plan.getId());
        auditLog.info(plan.getId(), "", "Starting plan execution (dry-run: " + plan.isDryRun() + ")");
        
        Span span = tracer.spanBuilder("remediation.plan")
            .setAttribute("plan_id", plan.getId())
            .setAttribute("scan_id", plan.getScanId())
            .setAttribute("dry_run", plan.isDryRun())
            .setAttribute("actions", plan.getTotalActions())
            .startSpan();
        
        RemediationStatus terminal = RemediationStatus.FAILED;
        try (Scope scope = span.makeCurrent()) {
            List<RemediationResult> results = config.getMaxConcurrent() > 1
                ? executeConcurrently(plan, config)
                : executeSequentially(plan, config);
            
            terminal = plan.getFailureCount() == 0
                ? RemediationStatus.COMPLETED
                : RemediationStatus.FAILED;
            return results;
        } finally {
            try {
                completePlan(plan, terminal, span);
            } finally {
                span.end();
                MDC.remove(MDC_PLAN_ID);
            }
        }
    }
    
    /**
     * Move the plan to its terminal status. Runs even when execution escaped with an exception,
     * in which case the plan is FAILED.
     */
    private void completePlan(RemediationPlan plan, RemediationStatus terminal, Span span) {
        stateMachine.transition(plan, terminal);
        
        span.setAttribute("succeeded", plan.getSuccessCount());
        span.setAttribute("failed", plan.getFailureCount());
        span.setStatus(terminal == RemediationStatus.COMPLETED ? StatusCode.OK : StatusCode.ERROR);
        
        auditLog.record(terminal == RemediationStatus.COMPLETED ? AuditLevel.SUCCESS : AuditLevel.ERROR,
            plan.getId(), "",
            String.format("Plan completed: %d succeeded, %d failed", plan.getSuccessCount(), plan.getFailureCount()),
            Map.of("cancelled", plan.getCancelledCount()));
        metrics.recordPlanCompleted(plan);
    }
    
    private List<RemediationResult> executeSequentially(RemediationPlan plan, RemediationConfig config) {
        List<RemediationResult> results = new ArrayList<>();
        
        for (String actionId : plan.getExecutionOrder()) {
            Optional<RemediationAction> found = plan.findAction(actionId);
            if (found.isEmpty()) {
                log.warn("Execution order references unknown action {}", actionId);
                continue;
            }
            RemediationAction action = found.get();
            
            if (!admit(plan, action, config)) {
                continue;
            }
            
            RemediationResult result = runAction(plan, action, config);
            results.add(result);
            
            if (!result.isSuccess() && !config.isContinueOnError()) {
                auditLog.error(plan.getId(), "", "Stopping execution due to failure: " + result.getError(), null);
                break;
            }
        }
        
        return results;
    }
    
    /**
     * At most {@code maxConcurrent} actions in flight. After a failure with
     * {@code continueOnError=false} no further action starts; in-flight ones finish and are counted.
     */
    private List<RemediationResult> executeConcurrently(RemediationPlan plan, RemediationConfig config) {
        int slots = config.getMaxConcurrent();
        ExecutorService workers = Executors.newFixedThreadPool(slots, workerThreadFactory(plan.getId()));
        Semaphore permits = new Semaphore(slots);
        AtomicBoolean halted = new AtomicBoolean(false);
        List<Future<RemediationResult>> launched = new ArrayList<>();
        boolean interrupted = false;
        
        try {
            for (String actionId : plan.getExecutionOrder()) {
                Optional<RemediationAction> found = plan.findAction(actionId);
                if (found.isEmpty()) {
                    log.warn("Execution order references unknown action {}", actionId);
                    continue;
                }
                RemediationAction action = found.get();
                
                permits.acquire();
                if (halted.get()) {
                    permits.release();
                    break;
                }
                if (!admit(plan, action, config)) {
                    permits.release();
                    continue;
                }
                
                launched.add(workers.submit(Context.current().wrap(() -> {
                    try {
                        RemediationResult result = runAction(plan, action, config);
                        if (!result.isSuccess() && !config.isContinueOnError()
                            && halted.compareAndSet(false, true)) {
                            auditLog.error(plan.getId(), "",
                                "Stopping execution due to failure: " + result.getError(), null);
                        }
                        return result;
                    } finally {
                        permits.release();
                    }
                })));
            }
        } catch (InterruptedException e) {
            interrupted = true;
            log.warn("Interrupted while scheduling actions for plan {}; waiting for in-flight actions", plan.getId());
        } finally {
            workers.shutdown();
        }
        
        List<RemediationResult> results = new ArrayList<>(launched.size());
        RuntimeException workerFailure = null;
        for (Future<RemediationResult> future : launched) {
            try {
                results.add(awaitResult(future));
            } catch (RuntimeException e) {
                if (workerFailure == null) {
                    workerFailure = e;
                } else {
                    workerFailure.addSuppressed(e);
                }
            }
        }
        
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        if (workerFailure != null) {
            throw workerFailure;
        }
        return results;
    }
    
    /**
     * Decide whether an action may start. Denied actions are cancelled and counted.
     */
    private boolean admit(RemediationPlan plan, RemediationAction action, RemediationConfig config) {
        if (!action.isRequiresApproval() || config.isAutoApprove()) {
            stateMachine.transition(action, RemediationStatus.APPROVED,
                config.isAutoApprove() ? "auto-approved" : "approval not required");
            return true;
        }
        
        boolean approved = requestApproval(plan, action, config);
        metrics.recordApprovalDecision(action, approved);
        
        if (!approved) {
            stateMachine.transition(action, RemediationStatus.CANCELLED, "approval denied");
            synchronized (plan) {
                plan.setCancelledCount(plan.getCancelledCount() + 1);
            }
            auditLog.warn(plan.getId(), action.getId(), "Action cancelled: approval denied");
            return false;
        }
        
        stateMachine.transition(action, RemediationStatus.APPROVED, "approved");
        return true;
    }
    
    private boolean requestApproval(RemediationPlan plan, RemediationAction action, RemediationConfig config) {
        try {
            return approvalGate.requestApproval(plan.getId(), action, config);
        } catch (Exception e) {
            log.error("Approval gate failed for action {}, treating as denied", action.getId(), e);
            return false;
        }
    }
    
    private RemediationResult runAction(RemediationPlan plan, RemediationAction action, RemediationConfig config) {
        MDC.put(MDC_PLAN_ID, plan.getId());
        MDC.put(MDC_ACTION_ID, action.getId());
        
        Span span = tracer.spanBuilder("remediation.action")
            .setAttribute("plan_id", plan.getId())
            .setAttribute("action_id", action.getId())
            .setAttribute("resource", action.getResourceName())
            .setAttribute("severity", action.getSeverity().name())
            .setAttribute("strategy", action.getStrategy().name())
            .setAttribute("dry_run", plan.isDryRun())
            .startSpan();
        
        long start = clock.millis();
        try (Scope scope = span.makeCurrent()) {
            stateMachine.transition(action, RemediationStatus.IN_PROGRESS, "executing");
            auditLog.info(plan.getId(), action.getId(), "Executing: " + action.getDescription());
            
            String output;
            try {
                output = plan.isDryRun() ? preview(action) : perform(action, config);
            } catch (Exception e) {
                return fail(plan, action, config, span, start, e);
            }
            
            stateMachine.transition(action, RemediationStatus.COMPLETED, "succeeded");
            long duration = clock.millis() - start;
            auditLog.success(plan.getId(), action.getId(), "Completed in " + duration + "ms",
                Map.of(RemediationAuditLog.DURATION_KEY, duration));
            span.setStatus(StatusCode.OK);
            
            return finish(plan, action, RemediationResult.builder()
                .planId(plan.getId())
                .action(action)
                .success(true)
                .duration(duration)
                .output(output)
                .build());
        } finally {
            span.end();
            MDC.remove(MDC_ACTION_ID);
        }
    }
    
    private RemediationResult fail(RemediationPlan plan, RemediationAction action, RemediationConfig config,
                                   Span span, long start, Exception e) {
        String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        log.error("Action {} on {} failed: {}", action.getId(), action.getResourceName(), error);
        
        action.setError(error);
        stateMachine.transition(action, RemediationStatus.FAILED, error);
        long duration = clock.millis() - start;
        auditLog.error(plan.getId(), action.getId(), RemediationAuditLog.FAILURE_PREFIX + " " + error,
            Map.of(RemediationAuditLog.DURATION_KEY, duration));
        span.recordException(e);
        span.setStatus(StatusCode.ERROR, error);
        
        boolean rolledBack = !plan.isDryRun()
            && config.isRollbackOnError()
            && action.getRollbackData() != null
            && rollback(plan, action);
        
        return finish(plan, action, RemediationResult.builder()
            .planId(plan.getId())
            .action(action)
            .success(false)
            .duration(duration)
            .error(error)
            .rollbackPerformed(rolledBack)
            .build());
    }
    
    private String preview(RemediationAction action) {
        String output = processRunner.plan(action);
        action.setTerraformPlan(output);
        return output;
    }
    
    private String perform(RemediationAction action, RemediationConfig config) {
        return switch (action.getStrategy()) {
            case TERRAFORM_APPLY -> processRunner.apply(action, config.isBackupBeforeChange());
            case TERRAFORM_UPDATE -> processRunner.rewriteCode(action);
            case MANUAL -> MANUAL_OUTPUT;
            case IGNORE -> throw new IllegalStateException("Ignored drift has no remediation: " + action.getId());
        };
    }
    
    private boolean rollback(RemediationPlan plan, RemediationAction action) {
        auditLog.warn(plan.getId(), action.getId(), "Attempting rollback...");
        try {
            processRunner.rollback(action);
            stateMachine.transition(action, RemediationStatus.ROLLED_BACK, "rollback succeeded");
            auditLog.success(plan.getId(), action.getId(), RemediationAuditLog.ROLLBACK_SUCCEEDED, null);
            metrics.recordRollback(true);
            return true;
        } catch (Exception e) {
            log.error("Rollback of action {} failed", action.getId(), e);
            auditLog.error(plan.getId(), action.getId(), "Rollback failed: " + e.getMessage(), null);
            metrics.recordRollback(false);
            return false;
        }
    }
    
    private RemediationResult finish(RemediationPlan plan, RemediationAction action, RemediationResult result) {
        synchronized (plan) {
            if (result.isSuccess()) {
                plan.setSuccessCount(plan.getSuccessCount() + 1);
            } else {
                plan.setFailureCount(plan.getFailureCount() + 1);
            }
        }
        metrics.recordActionOutcome(action, result.isSuccess(), result.getDuration());
        return result;
    }
    
    private static RemediationResult awaitResult(Future<RemediationResult> future) {
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    return future.get();
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (ExecutionException e) {
                    throw new IllegalStateException("Remediation worker failed", e.getCause());
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
    
    private static ThreadFactory workerThreadFactory(String planId) {
        AtomicInteger counter = new AtomicInteger();
        String prefix = "remediation-" + (planId.length() > 8 ? planId.substring(0, 8) : planId) + "-";
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
