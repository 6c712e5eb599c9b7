package com.platform.driftcontrol.remediation;

/**
 * Lifecycle status shared by actions and plans.
 * 
 * Action transitions are validated by ActionStateMachine:
 * PENDING -> APPROVED | CANCELLED, APPROVED -> IN_PROGRESS,
 * IN_PROGRESS -> COMPLETED | FAILED, FAILED -> ROLLED_BACK.
 */
public enum RemediationStatus {
    PENDING,
    APPROVED,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    ROLLED_BACK,
    CANCELLED;
    
    /**
     * Checks if no further transition is expected from this status.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == ROLLED_BACK || this == CANCELLED;
    }
}
