package io.github.shiftlog.workforce.domain.exception;

public class ScopeMismatchException extends WorkforceException {

    public ScopeMismatchException(String entity, Object id, Long companyId) {
        super(ErrorCode.SCOPE_MISMATCH, entity + " " + id + " does not belong to company " + companyId);
    }
}
