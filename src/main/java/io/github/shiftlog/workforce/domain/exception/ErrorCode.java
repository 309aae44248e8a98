package io.github.shiftlog.workforce.domain.exception;

/**
 * Tag carried by every {@link WorkforceException}; callers branch on this instead of messages.
 */
public enum ErrorCode {
    NOT_FOUND,
    INVALID_STATE_TRANSITION,
    CONFLICT,
    ALREADY_USED,
    SCOPE_MISMATCH,
    VALIDATION,
    RULE_INACTIVE
}
