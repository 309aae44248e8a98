package io.github.shiftlog.workforce.domain.exception;

public class ConflictException extends WorkforceException {

    public ConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }

    protected ConflictException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
}
