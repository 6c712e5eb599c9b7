package com.platform.driftcontrol.remediation;

/**
 * Risk classification of a remediation action, in ascending order of risk.
 * The declaration order is the execution order of a plan.
 */
public enum RemediationSeverity {
    SAFE,           // Tags and labels
    LOW_RISK,       // Descriptions, names, monitoring
    MEDIUM_RISK,    // Policies, roles, encryption
    HIGH_RISK,      // Networking, security groups, instance sizing
    CRITICAL;       // Deletions
    
    public int rank() {
        return ordinal();
    }
    
    public boolean isDestructive() {
        return this == CRITICAL;
    }
}
