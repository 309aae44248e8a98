package io.github.shiftlog.workforce.domain.exception;

public class NotFoundException extends WorkforceException {

    public NotFoundException(String entity, Object id) {
        super(ErrorCode.NOT_FOUND, entity + " not found: " + id);
    }
}
