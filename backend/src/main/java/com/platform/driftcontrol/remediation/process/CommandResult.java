package com.platform.driftcontrol.remediation.process;

/**
 * Captured outcome of one terraform invocation.
 */
public record CommandResult(int exitCode, String stdout, String stderr, long durationMs) {
    
    public boolean succeeded() {
        return exitCode == 0;
    }
}
