package com.platform.driftcontrol.remediation;

/**
 * Kind of corrective operation for a drifted property.
 */
public enum RemediationStrategy {
    
    /**
     * Rewrite the declarative source so it matches the live value.
     */
    TERRAFORM_UPDATE,
    
    /**
     * Apply the declared value to live infrastructure.
     */
    TERRAFORM_APPLY,
    
    /**
     * No automated action; an operator has to fix it.
     */
    MANUAL,
    
    /**
     * Drift is expected (read-only attributes); no action is emitted.
     */
    IGNORE;
    
    /**
     * Checks if executing this strategy changes infrastructure or source files.
     */
    public boolean isMutating() {
        return this == TERRAFORM_UPDATE || this == TERRAFORM_APPLY;
    }
}
