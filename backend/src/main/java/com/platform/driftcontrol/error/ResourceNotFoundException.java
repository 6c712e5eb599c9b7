package com.platform.driftcontrol.error;

/**
 * Exception for resource not found errors.
 */
public class ResourceNotFoundException extends DriftControlException {
    
    private final String resourceType;
    private final String resourceId;
    
    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode, 
            String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public static ResourceNotFoundException plan(String planId) {
        return new ResourceNotFoundException(ErrorCode.PLAN_NOT_FOUND, "RemediationPlan", planId);
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
