package com.platform.driftcontrol.drift;

import java.util.List;

/**
 * Drift detected for one resource during a scan, as handed over by the drift detector.
 * Only records with {@code hasDrift == true} are remediated.
 */
public record DriftResult(
    String resourceId,
    String resourceName,
    String resourceType,
    boolean hasDrift,
    String severity,
    List<DriftedProperty> driftedProperties
) {
    
    public DriftResult {
        driftedProperties = driftedProperties == null ? List.of() : List.copyOf(driftedProperties);
    }
    
    public static DriftResult drifted(String resourceId, String resourceName, DriftedProperty... properties) {
        return new DriftResult(resourceId, resourceName, null, true, null, List.of(properties));
    }
}
