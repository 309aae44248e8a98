package io.github.shiftlog.workforce.application.dto;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Dashboard figures for one company and the current rating period.
 */
public record CompanyStats(
        Long companyId,
        int employeeCount,
        int activeShiftCount,
        int violationCount,
        BigDecimal averageRating, // null when no rating was computed yet
        LocalDate periodStart,
        LocalDate periodEnd
) implements Serializable {
}
