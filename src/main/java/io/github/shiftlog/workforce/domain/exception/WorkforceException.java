package io.github.shiftlog.workforce.domain.exception;

/**
 * Base type for recoverable domain failures. Storage failures are not wrapped in this type;
 * they surface as Spring {@code DataAccessException}.
 */
public abstract class WorkforceException extends RuntimeException {

    private final ErrorCode errorCode;

    protected WorkforceException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
