package io.github.shiftlog.workforce.domain.exception;

public class RuleInactiveException extends WorkforceException {

    public RuleInactiveException(Long ruleId) {
        super(ErrorCode.RULE_INACTIVE, "violation rule is inactive: " + ruleId);
    }
}
