package io.github.shiftlog.workforce.application.service;

import io.github.shiftlog.workforce.application.cache.CompanyChangeNotifier;
import io.github.shiftlog.workforce.application.repository.EmployeeRatingRepository;
import io.github.shiftlog.workforce.application.repository.EmployeeRepository;
import io.github.shiftlog.workforce.application.repository.ViolationRepository;
import io.github.shiftlog.workforce.config.WorkforceProperties;
import io.github.shiftlog.workforce.domain.exception.NotFoundException;
import io.github.shiftlog.workforce.domain.exception.ValidationException;
import io.github.shiftlog.workforce.domain.model.RatingPeriod;
import io.github.shiftlog.workforce.domain.model.RatingSource;
import io.github.shiftlog.workforce.domain.model.RatingStatus;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Employee;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.EmployeeRating;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Violation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Period ratings derived from violation penalty snapshots.
 * <p>
 * {@code rating = clamp(100 - sum(penalty) + manualAdjustment, 0, 100)}. The manual adjustment is the
 * effective offset left by {@link #adjustRating} and survives later recalculations. Both write paths
 * lock the period row before reading the adjustment, so concurrent writers serialize on it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RatingService {

    static final BigDecimal MAX_RATING = BigDecimal.valueOf(100);
    static final BigDecimal MAX_DELTA = BigDecimal.valueOf(100);

    private final EmployeeRatingRepository ratingRepository;
    private final ViolationRepository violationRepository;
    private final EmployeeRepository employeeRepository;
    private final CompanyChangeNotifier changeNotifier;
    private final WorkforceProperties properties;
    private final Clock clock;

    @Transactional
    public EmployeeRating recalculate(Long employeeId, LocalDate periodStart, LocalDate periodEnd) {
        RatingPeriod period = period(periodStart, periodEnd);
        Employee employee = requireEmployee(employeeId);
        EmployeeRating row = lock(employee, period);
        BigDecimal base = baseRating(employee, period);
        return store(row, employee, base, adjustmentOf(row));
    }

    @Transactional
    public EmployeeRating recalculateCurrentPeriod(Long employeeId) {
        RatingPeriod period = currentPeriod();
        return recalculate(employeeId, period.start(), period.end());
    }

    /**
     * Moves the period's rating by {@code delta} from its current value and clamps the result.
     * Only the offset that took effect after clamping is kept as the manual adjustment.
     */
    @Transactional
    public EmployeeRating adjustRating(Long employeeId, BigDecimal delta, LocalDate periodStart, LocalDate periodEnd) {
        if (delta == null || delta.abs().compareTo(MAX_DELTA) > 0) {
            throw new ValidationException("delta must be between -100 and 100");
        }
        RatingPeriod period = period(periodStart, periodEnd);
        Employee employee = requireEmployee(employeeId);
        EmployeeRating row = lock(employee, period);
        BigDecimal base = baseRating(employee, period);
        BigDecimal current = clamp(base.add(adjustmentOf(row)));
        BigDecimal target = clamp(current.add(delta));
        EmployeeRating adjusted = store(row, employee, base, target.subtract(base));
        log.info("Rating adjusted manually: employeeId={}, period={}, delta={}, rating {} -> {}",
                employeeId, period, delta, current, adjusted.getRating());
        return adjusted;
    }

    public EmployeeRating getCurrentPeriod(Long employeeId) {
        RatingPeriod period = currentPeriod();
        return getForPeriod(employeeId, period.start(), period.end());
    }

    public EmployeeRating getForPeriod(Long employeeId, LocalDate periodStart, LocalDate periodEnd) {
        RatingPeriod period = period(periodStart, periodEnd);
        EmployeeRating rating = ratingRepository.findByEmployeeAndPeriod(employeeId, period.start(), period.end());
        if (rating == null) {
            throw new NotFoundException("Rating", employeeId + " " + period);
        }
        return rating;
    }

    @Transactional
    public List<EmployeeRating> recalculateCompany(Long companyId, LocalDate periodStart, LocalDate periodEnd) {
        RatingPeriod period = periodStart == null && periodEnd == null ? currentPeriod() : period(periodStart, periodEnd);
        List<EmployeeRating> results = new ArrayList<>();
        for (Employee employee : employeeRepository.listByCompany(companyId)) {
            results.add(recalculate(employee.getId(), period.start(), period.end()));
        }
        log.info("Company ratings recalculated: companyId={}, period={}, employees={}", companyId, period, results.size());
        return results;
    }

    public List<EmployeeRating> listCompanyRatings(Long companyId, LocalDate periodStart, LocalDate periodEnd) {
        RatingPeriod period = periodStart == null && periodEnd == null ? currentPeriod() : period(periodStart, periodEnd);
        return ratingRepository.listByCompanyAndPeriod(companyId, period.start(), period.end());
    }

    public RatingPeriod currentPeriod() {
        return RatingPeriod.current(clock, zone());
    }

    RatingStatus statusFor(BigDecimal rating) {
        if (rating.compareTo(properties.getRating().getTerminatedBelow()) < 0) {
            return RatingStatus.TERMINATED;
        }
        if (rating.compareTo(properties.getRating().getWarningBelow()) < 0) {
            return RatingStatus.WARNING;
        }
        return RatingStatus.ACTIVE;
    }

    static BigDecimal clamp(BigDecimal value) {
        if (value.signum() < 0) {
            return BigDecimal.ZERO;
        }
        return value.compareTo(MAX_RATING) > 0 ? MAX_RATING : value;
    }

    /** {@code 100 - sum(penalty)} for the period, before adjustment and clamping. */
    private BigDecimal baseRating(Employee employee, RatingPeriod period) {
        List<Violation> violations = violationRepository.listByEmployee(
                employee.getId(), period.startInstant(zone()), period.endInstant(zone()));
        BigDecimal totalPenalty = violations.stream()
                .map(Violation::getPenalty)
                .filter(p -> p != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return MAX_RATING.subtract(totalPenalty);
    }

    /** Penalties are read after this returns so they include whatever the previous lock holder saw. */
    private EmployeeRating lock(Employee employee, RatingPeriod period) {
        EmployeeRating initial = new EmployeeRating();
        initial.setEmployeeId(employee.getId());
        initial.setCompanyId(employee.getCompanyId());
        initial.setPeriodStart(period.start());
        initial.setPeriodEnd(period.end());
        initial.setRating(MAX_RATING);
        initial.setManualAdjustment(BigDecimal.ZERO);
        initial.setSource(RatingSource.COMPUTED);
        initial.setStatus(RatingStatus.ACTIVE);
        initial.setUpdatedAt(clock.instant());
        return ratingRepository.lockOrCreate(initial);
    }

    private EmployeeRating store(EmployeeRating row, Employee employee, BigDecimal base, BigDecimal adjustment) {
        BigDecimal value = clamp(base.add(adjustment));
        row.setCompanyId(employee.getCompanyId());
        row.setRating(value);
        row.setManualAdjustment(adjustment);
        row.setSource(adjustment.signum() == 0 ? RatingSource.COMPUTED : RatingSource.MANUALLY_ADJUSTED);
        row.setStatus(statusFor(value));
        row.setUpdatedAt(clock.instant());
        ratingRepository.upsert(row);

        log.info("Rating stored: employeeId={}, period={}..{}, base={}, adjustment={}, rating={}, status={}",
                employee.getId(), row.getPeriodStart(), row.getPeriodEnd(), base, adjustment, value, row.getStatus());
        changeNotifier.companyChanged(employee.getCompanyId());
        return row;
    }

    private static BigDecimal adjustmentOf(EmployeeRating row) {
        return row.getManualAdjustment() != null ? row.getManualAdjustment() : BigDecimal.ZERO;
    }

    private Employee requireEmployee(Long employeeId) {
        Employee employee = employeeId == null ? null : employeeRepository.findById(employeeId);
        if (employee == null) {
            throw new NotFoundException("Employee", employeeId);
        }
        return employee;
    }

    private static RatingPeriod period(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new ValidationException("periodStart and periodEnd are required");
        }
        return RatingPeriod.of(start, end);
    }

    private ZoneId zone() {
        return properties.getZoneId();
    }
}
