package com.platform.driftcontrol.error;

/**
 * Exception for infrastructure tool invocations that could not start,
 * timed out, or exited with a non-zero status.
 */
public class ProcessExecutionException extends DriftControlException {
    
    private final String operation;
    private final int exitCode;
    private final String stderr;
    
    public ProcessExecutionException(ErrorCode errorCode, String operation, int exitCode, String stderr, String message) {
        super(errorCode, message);
        this.operation = operation;
        this.exitCode = exitCode;
        this.stderr = stderr;
    }
    
    public ProcessExecutionException(ErrorCode errorCode, String operation, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.operation = operation;
        this.exitCode = -1;
        this.stderr = "";
    }
    
    public static ProcessExecutionException nonZeroExit(String operation, int exitCode, String stderr) {
        return new ProcessExecutionException(
            ErrorCode.PROCESS_FAILED,
            operation,
            exitCode,
            stderr,
            String.format("Terraform %s failed (exit %d): %s", operation, exitCode, stderr.strip())
        );
    }
    
    public static ProcessExecutionException timedOut(String operation, long timeoutSeconds) {
        return new ProcessExecutionException(
            ErrorCode.PROCESS_TIMEOUT,
            operation,
            -1,
            "",
            String.format("Terraform %s did not finish within %ds", operation, timeoutSeconds)
        );
    }
    
    public static ProcessExecutionException startFailed(String operation, String binary, Throwable cause) {
        return new ProcessExecutionException(
            ErrorCode.PROCESS_UNAVAILABLE,
            operation,
            String.format("Could not run '%s' for %s: %s", binary, operation, cause.getMessage()),
            cause
        );
    }
    
    public String getOperation() {
        return operation;
    }
    
    public int getExitCode() {
        return exitCode;
    }
    
    public String getStderr() {
        return stderr;
    }
}
