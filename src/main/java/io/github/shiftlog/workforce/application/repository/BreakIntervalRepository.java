package io.github.shiftlog.workforce.application.repository;

import io.github.shiftlog.workforce.infrastructure.persistence.entity.BreakInterval;

import java.time.Instant;
import java.util.List;

public interface BreakIntervalRepository {
    /**
     * Inserts the interval only when the shift has neither an open work nor an open break interval.
     *
     * @return 1 when inserted, 0 otherwise
     */
    int insertIfNoneOpen(BreakInterval interval);

    int closeOpen(Long shiftId, Instant endAt);

    BreakInterval findOpen(Long shiftId);

    List<BreakInterval> listByShift(Long shiftId);
}
