package io.github.shiftlog.workforce.domain.model;

public enum ViolationSource {
    MANUAL,
    AUTO
}
