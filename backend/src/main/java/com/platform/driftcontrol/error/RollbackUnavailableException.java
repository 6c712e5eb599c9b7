package com.platform.driftcontrol.error;

/**
 * Raised when a rollback is requested for an action without a recorded state backup.
 */
public class RollbackUnavailableException extends DriftControlException {
    
    private final String actionId;
    
    public RollbackUnavailableException(String actionId) {
        super(ErrorCode.ROLLBACK_UNAVAILABLE, "No rollback data available for action " + actionId);
        this.actionId = actionId;
    }
    
    public String getActionId() {
        return actionId;
    }
}
