package com.platform.driftcontrol.remediation.process.source;

import java.nio.file.Path;

/**
 * A single-line edit applied to a source file.
 */
public record SourceRewrite(Path file, int lineNumber, String before, String after) {
    
    public String describe() {
        return String.format("Updated %s:%d%n- %s%n+ %s", file, lineNumber, before.strip(), after.strip());
    }
}
