package com.platform.driftcontrol.audit;

import java.util.List;

/**
 * Aggregates derived from every persisted audit partition.
 */
public record RemediationStatistics(
    long totalPlans,
    long totalActions,
    long successfulActions,
    long failedActions,
    long rolledBackActions,
    double averageDuration,
    List<FailureCount> mostCommonFailures
) {
    
    public record FailureCount(String error, long count) {
    }
}
