package com.platform.driftcontrol.error;

/**
 * Base exception for all drift control exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class DriftControlException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected DriftControlException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected DriftControlException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
