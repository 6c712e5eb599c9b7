package com.platform.driftcontrol.remediation.classify;

import com.platform.driftcontrol.remediation.RemediationSeverity;
import com.platform.driftcontrol.remediation.RemediationStrategy;

/**
 * Strategy and risk for one drifted property.
 */
public record Classification(
    RemediationStrategy strategy,
    RemediationSeverity severity,
    String resourceType
) {
    
    public boolean requiresApproval() {
        return severity != RemediationSeverity.SAFE;
    }
    
    public boolean isIgnored() {
        return strategy == RemediationStrategy.IGNORE;
    }
}
