package io.github.shiftlog.workforce.application.repository;

import io.github.shiftlog.workforce.domain.model.ShiftStatus;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Shift;

import java.time.Instant;
import java.util.List;

public interface ShiftRepository {
    Shift findById(Long id);

    void save(Shift shift);

    /**
     * Moves the shift from {@code expected} to {@code next} only if it is still in {@code expected}.
     * Null timestamps leave the stored value untouched.
     *
     * @return affected row count, 0 when the shift is missing or its status changed concurrently
     */
    int updateStatus(Long id, ShiftStatus expected, ShiftStatus next, Instant actualStartAt, Instant actualEndAt);

    List<Shift> listActiveByCompany(Long companyId);

    List<Shift> listScheduledStartingBefore(Instant cutoff);

    List<Shift> listStartedSince(Instant since);
}
