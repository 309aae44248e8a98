package io.github.shiftlog.workforce.domain.exception;

/** Invite code was redeemed before, possibly by a concurrent request. */
public class AlreadyUsedException extends ConflictException {

    public AlreadyUsedException(String code) {
        super(ErrorCode.ALREADY_USED, "invite already used: " + code);
    }
}
