package io.github.shiftlog.workforce.domain.model;

/**
 * Shift lifecycle states.
 * SCHEDULED -> ACTIVE <-> PAUSED -> COMPLETED, and CANCELLED from any non-terminal state.
 */
public enum ShiftStatus {
    SCHEDULED,
    ACTIVE,
    PAUSED,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
