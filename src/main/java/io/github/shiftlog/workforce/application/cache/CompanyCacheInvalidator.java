package io.github.shiftlog.workforce.application.cache;

/**
 * Drops cached per-company aggregates. Implementations may fail; callers treat it as best effort.
 */
public interface CompanyCacheInvalidator {
    void invalidate(Long companyId);
}
