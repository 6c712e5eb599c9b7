package com.platform.driftcontrol.error;

import java.nio.file.Path;

/**
 * Raised when the declarative source for a resource cannot be located or updated.
 */
public class SourceRewriteException extends DriftControlException {
    
    private final String resourceName;
    private final String propertyPath;
    
    public SourceRewriteException(String resourceName, String propertyPath, String message) {
        super(ErrorCode.SOURCE_REWRITE_FAILED, message);
        this.resourceName = resourceName;
        this.propertyPath = propertyPath;
    }
    
    public SourceRewriteException(String resourceName, String propertyPath, String message, Throwable cause) {
        super(ErrorCode.SOURCE_REWRITE_FAILED, message, cause);
        this.resourceName = resourceName;
        this.propertyPath = propertyPath;
    }
    
    public static SourceRewriteException resourceNotFound(String resourceName, Path searchRoot) {
        return new SourceRewriteException(resourceName, null,
            String.format("Could not find terraform file for resource: %s (searched %s)", resourceName, searchRoot));
    }
    
    public static SourceRewriteException propertyNotFound(String resourceName, String propertyPath, Path file) {
        return new SourceRewriteException(resourceName, propertyPath,
            String.format("Property %s not assigned in resource %s (%s)", propertyPath, resourceName, file));
    }
    
    public String getResourceName() {
        return resourceName;
    }
    
    public String getPropertyPath() {
        return propertyPath;
    }
}
