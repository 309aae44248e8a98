package io.github.shiftlog.workforce.application.repository;

import io.github.shiftlog.workforce.infrastructure.persistence.entity.Violation;

import java.time.Instant;
import java.util.List;

public interface ViolationRepository {
    Violation findById(Long id);

    void save(Violation violation);

    /** Half-open {@code [from, to)}; a null bound is unbounded. */
    List<Violation> listByEmployee(Long employeeId, Instant from, Instant to);

    /** Half-open {@code [from, to)}; a null bound is unbounded. */
    List<Violation> listByCompany(Long companyId, Instant from, Instant to);

    boolean existsByShiftAndRule(Long shiftId, Long ruleId);
}
