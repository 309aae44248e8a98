package io.github.shiftlog.workforce.application.repository;

import io.github.shiftlog.workforce.infrastructure.persistence.entity.WorkInterval;

import java.time.Instant;
import java.util.List;

public interface WorkIntervalRepository {
    /**
     * Inserts the interval only when the shift has neither an open work nor an open break interval.
     *
     * @return 1 when inserted, 0 otherwise
     */
    int insertIfNoneOpen(WorkInterval interval);

    int closeOpen(Long shiftId, Instant endAt);

    WorkInterval findOpen(Long shiftId);

    List<WorkInterval> listByShift(Long shiftId);
}
