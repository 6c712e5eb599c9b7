package com.platform.driftcontrol.remediation.execution;

import com.platform.driftcontrol.error.InvalidStateTransitionException;
import com.platform.driftcontrol.remediation.RemediationAction;
import com.platform.driftcontrol.remediation.RemediationPlan;
import com.platform.driftcontrol.remediation.RemediationStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Map;
import java.util.Set;

/**
 * Guards status changes of actions and plans and stamps their timestamps.
 */
@Slf4j
public class ActionStateMachine {
    
    // Valid action transitions (from -> to)
    private static final Map<RemediationStatus, Set<RemediationStatus>> ACTION_TRANSITIONS = Map.of(
        RemediationStatus.PENDING, Set.of(RemediationStatus.APPROVED, RemediationStatus.CANCELLED),
        RemediationStatus.APPROVED, Set.of(RemediationStatus.IN_PROGRESS),
        RemediationStatus.IN_PROGRESS, Set.of(RemediationStatus.COMPLETED, RemediationStatus.FAILED),
        RemediationStatus.FAILED, Set.of(RemediationStatus.ROLLED_BACK)
    );
    
    // Valid plan transitions (from -> to)
    private static final Map<RemediationStatus, Set<RemediationStatus>> PLAN_TRANSITIONS = Map.of(
        RemediationStatus.PENDING, Set.of(RemediationStatus.IN_PROGRESS),
        RemediationStatus.IN_PROGRESS, Set.of(RemediationStatus.COMPLETED, RemediationStatus.FAILED)
    );
    
    private final Clock clock;
    
    public ActionStateMachine(Clock clock) {
        this.clock = clock;
    }
    
    /**
     * Move an action to the target status.
     *
     * @throws InvalidStateTransitionException if the edge is not allowed
     */
    public void transition(RemediationAction action, RemediationStatus target, String reason) {
        RemediationStatus previous = action.getStatus();
        if (!isActionTransitionAllowed(previous, target)) {
            log.warn("Invalid action transition rejected: {} -> {} for {}", previous, target, action.getId());
            throw new InvalidStateTransitionException(action.getId(), previous, target);
        }
        
        action.setStatus(target);
        switch (target) {
            case IN_PROGRESS -> action.setExecutedAt(clock.instant());
            case COMPLETED, FAILED -> action.setCompletedAt(clock.instant());
            default -> {
            }
        }
        
        log.debug("Action {} {} -> {} (reason: {})", action.getId(), previous, target, reason);
    }
    
    /**
     * Move a plan to the target status.
     *
     * @throws InvalidStateTransitionException if the edge is not allowed
     */
    public void transition(RemediationPlan plan, RemediationStatus target) {
        RemediationStatus previous = plan.getStatus();
        if (!isPlanTransitionAllowed(previous, target)) {
            log.warn("Invalid plan transition rejected: {} -> {} for {}", previous, target, plan.getId());
            throw new InvalidStateTransitionException(plan.getId(), previous, target);
        }
        
        plan.setStatus(target);
        if (target == RemediationStatus.IN_PROGRESS) {
            plan.setStartedAt(clock.instant());
        } else {
            plan.setCompletedAt(clock.instant());
        }
        
        log.info("Plan {} {} -> {}", plan.getId(), previous, target);
    }
    
    public static boolean isActionTransitionAllowed(RemediationStatus from, RemediationStatus to) {
        return ACTION_TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }
    
    public static boolean isPlanTransitionAllowed(RemediationStatus from, RemediationStatus to) {
        return PLAN_TRANSITIONS.getOrDefault(from, Set.of()).contains(to);
    }
}
