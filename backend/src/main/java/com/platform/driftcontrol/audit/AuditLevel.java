package com.platform.driftcontrol.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Level of an audit entry.
 */
public enum AuditLevel {
    INFO,
    WARN,
    ERROR,
    SUCCESS;
    
    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
    
    @JsonCreator
    public static AuditLevel fromWireName(String value) {
        return AuditLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
