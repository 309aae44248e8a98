package io.github.shiftlog.workforce.domain.model;

public enum BreakKind {
    LUNCH,
    BREAK,
    OTHER
}
