package com.platform.driftcontrol.remediation.process;

import com.platform.driftcontrol.remediation.RemediationAction;

/**
 * Adapter over the infrastructure tool. Every operation either returns its captured
 * output or throws; a non-zero exit is never reported as success.
 */
public interface ProcessRunner {
    
    /**
     * Preview the change scoped to the action's resource. Never mutates anything.
     */
    String plan(RemediationAction action);
    
    /**
     * Apply the change scoped to the action's resource. When {@code backupBeforeChange}
     * is set and a backup succeeds, the action's rollback data points at it before the
     * apply starts.
     */
    String apply(RemediationAction action, boolean backupBeforeChange);
    
    default String apply(RemediationAction action) {
        return apply(action, true);
    }
    
    /**
     * Rewrite the declarative source so it matches the live value.
     */
    String rewriteCode(RemediationAction action);
    
    /**
     * Restore the state recorded in the action's rollback data.
     */
    void rollback(RemediationAction action);
}
