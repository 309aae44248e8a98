package io.github.shiftlog.workforce.domain.exception;

public class ValidationException extends WorkforceException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION, message);
    }
}
