package com.platform.driftcontrol.audit;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * One remediation event. Plan-level events carry an empty actionId.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEntry(
    Instant timestamp,
    String planId,
    String actionId,
    AuditLevel level,
    String message,
    Map<String, Object> metadata
) {
    
    public AuditEntry {
        planId = planId == null ? "" : planId;
        actionId = actionId == null ? "" : actionId;
        metadata = metadata == null || metadata.isEmpty() ? null : Map.copyOf(metadata);
    }
    
    /**
     * Duration in milliseconds when the entry carries one.
     */
    public Double durationMillis() {
        if (metadata == null) {
            return null;
        }
        Object value = metadata.get(RemediationAuditLog.DURATION_KEY);
        return value instanceof Number number ? number.doubleValue() : null;
    }
}
