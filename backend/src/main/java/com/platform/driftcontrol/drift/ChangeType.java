package com.platform.driftcontrol.drift;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a drifted property differs from its declaration.
 */
public enum ChangeType {
    ADDED,      // Present in the cloud, absent from the declaration
    REMOVED,    // Declared, missing in the cloud
    MODIFIED;   // Present in both with different values
    
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
    
    @JsonCreator
    public static ChangeType fromWireName(String value) {
        return ChangeType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
