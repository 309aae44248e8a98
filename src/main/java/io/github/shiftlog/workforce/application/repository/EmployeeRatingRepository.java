package io.github.shiftlog.workforce.application.repository;

import io.github.shiftlog.workforce.infrastructure.persistence.entity.EmployeeRating;

import java.time.LocalDate;
import java.util.List;

public interface EmployeeRatingRepository {
    EmployeeRating findByEmployeeAndPeriod(Long employeeId, LocalDate periodStart, LocalDate periodEnd);

    /**
     * Returns the row for the initial row's (employee, periodStart, periodEnd), inserting {@code initial}
     * first when there is none. The row stays locked until the surrounding transaction ends.
     */
    EmployeeRating lockOrCreate(EmployeeRating initial);

    /** Insert or replace the row keyed by (employee, periodStart, periodEnd). */
    void upsert(EmployeeRating rating);

    List<EmployeeRating> listByCompanyAndPeriod(Long companyId, LocalDate periodStart, LocalDate periodEnd);
}
