package com.platform.driftcontrol.remediation.process.source;

import com.platform.driftcontrol.remediation.RemediationAction;

import java.nio.file.Path;

/**
 * Updates declarative infrastructure source so the declared value matches the live one.
 */
public interface SourceRewriter {
    
    /**
     * @param root directory searched for the resource definition
     * @throws com.platform.driftcontrol.error.SourceRewriteException if the resource or property cannot be found
     */
    SourceRewrite rewrite(Path root, RemediationAction action);
}
