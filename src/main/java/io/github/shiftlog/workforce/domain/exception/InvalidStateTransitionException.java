package io.github.shiftlog.workforce.domain.exception;

import io.github.shiftlog.workforce.domain.model.ShiftStatus;

public class InvalidStateTransitionException extends WorkforceException {

    private final String transition;
    private final ShiftStatus currentStatus;

    public InvalidStateTransitionException(String transition, ShiftStatus currentStatus) {
        super(ErrorCode.INVALID_STATE_TRANSITION,
                "cannot " + transition + " shift in status " + currentStatus);
        this.transition = transition;
        this.currentStatus = currentStatus;
    }

    public String getTransition() {
        return transition;
    }

    public ShiftStatus getCurrentStatus() {
        return currentStatus;
    }
}
