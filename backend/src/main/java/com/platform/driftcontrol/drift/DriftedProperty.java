package com.platform.driftcontrol.drift;

/**
 * One property whose observed value differs from the declared one.
 */
public record DriftedProperty(
    String propertyPath,
    Object expectedValue,
    Object actualValue,
    ChangeType changeType
) {
    
    public static DriftedProperty modified(String propertyPath, Object expectedValue, Object actualValue) {
        return new DriftedProperty(propertyPath, expectedValue, actualValue, ChangeType.MODIFIED);
    }
    
    public static DriftedProperty removed(String propertyPath, Object expectedValue) {
        return new DriftedProperty(propertyPath, expectedValue, null, ChangeType.REMOVED);
    }
}
