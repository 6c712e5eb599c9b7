package com.platform.driftcontrol.error;

/**
 * Raised when an action or plan is moved along an edge its state machine does not allow.
 */
public class InvalidStateTransitionException extends DriftControlException {
    
    private final String subjectId;
    private final String from;
    private final String to;
    
    public InvalidStateTransitionException(String subjectId, Enum<?> from, Enum<?> to) {
        super(ErrorCode.STATE_TRANSITION_INVALID,
            String.format("Invalid status transition %s -> %s for %s", from, to, subjectId));
        this.subjectId = subjectId;
        this.from = String.valueOf(from);
        this.to = String.valueOf(to);
    }
    
    public String getSubjectId() {
        return subjectId;
    }
    
    public String getFrom() {
        return from;
    }
    
    public String getTo() {
        return to;
    }
}
