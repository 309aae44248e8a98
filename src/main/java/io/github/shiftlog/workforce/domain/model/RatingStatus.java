package io.github.shiftlog.workforce.domain.model;

/** Standing derived from the rating value; thresholds come from {@code workforce.rating.*}. */
public enum RatingStatus {
    ACTIVE,
    WARNING,
    TERMINATED
}
