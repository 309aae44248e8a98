package io.github.shiftlog.workforce.domain.model;

public enum EmployeeStatus {
    ACTIVE,
    INACTIVE,
    ON_LEAVE
}
