package io.github.shiftlog.workforce.domain.model;

/**
 * Whether the stored rating is purely derived from violations or carries a manual offset.
 */
public enum RatingSource {
    COMPUTED,
    MANUALLY_ADJUSTED
}
