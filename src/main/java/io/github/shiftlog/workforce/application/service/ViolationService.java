package io.github.shiftlog.workforce.application.service;

import io.github.shiftlog.workforce.application.cache.CompanyChangeNotifier;
import io.github.shiftlog.workforce.application.repository.EmployeeRepository;
import io.github.shiftlog.workforce.application.repository.ViolationRepository;
import io.github.shiftlog.workforce.application.repository.ViolationRuleRepository;
import io.github.shiftlog.workforce.config.WorkforceProperties;
import io.github.shiftlog.workforce.domain.exception.NotFoundException;
import io.github.shiftlog.workforce.domain.exception.RuleInactiveException;
import io.github.shiftlog.workforce.domain.exception.ScopeMismatchException;
import io.github.shiftlog.workforce.domain.exception.ValidationException;
import io.github.shiftlog.workforce.domain.model.ViolationSource;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Employee;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Shift;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Violation;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.ViolationRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Records violations against employees.
 * <p>
 * The violation insert is the primary write and commits on its own. Rating recomputation and
 * stats invalidation run afterwards; their failures are logged and never undo the violation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ViolationService {

    static final String MONITOR_AUTHOR = "monitor";

    private final ViolationRepository violationRepository;
    private final ViolationRuleRepository ruleRepository;
    private final EmployeeRepository employeeRepository;
    private final RatingService ratingService;
    private final CompanyChangeNotifier changeNotifier;
    private final WorkforceProperties properties;
    private final Clock clock;

    public Violation recordViolation(Long employeeId, Long companyId, Long ruleId, ViolationSource source,
                                     String reason, String createdBy) {
        return record(employeeId, companyId, ruleId, null, source, reason, createdBy);
    }

    /**
     * Records a monitor-detected violation for a shift. Rules that are missing, inactive or not
     * auto-detectable are skipped, as is a rule already recorded for the same shift.
     */
    public Optional<Violation> recordAutoViolation(Shift shift, String ruleCode, String reason) {
        Employee employee = employeeRepository.findById(shift.getEmployeeId());
        if (employee == null) {
            log.debug("Skipping {} for shift {}: employee {} is gone", ruleCode, shift.getId(), shift.getEmployeeId());
            return Optional.empty();
        }
        ViolationRule rule = ruleRepository.findByCompanyAndCode(employee.getCompanyId(), ruleCode);
        if (rule == null || !rule.isActive() || !rule.isAutoDetectable()) {
            log.debug("Skipping {} for shift {}: no active auto-detectable rule in company {}",
                    ruleCode, shift.getId(), employee.getCompanyId());
            return Optional.empty();
        }
        if (violationRepository.existsByShiftAndRule(shift.getId(), rule.getId())) {
            return Optional.empty();
        }
        try {
            return Optional.of(record(employee.getId(), employee.getCompanyId(), rule.getId(), shift.getId(),
                    ViolationSource.AUTO, reason, MONITOR_AUTHOR));
        } catch (DuplicateKeyException e) {
            log.debug("Auto violation {} for shift {} already recorded", ruleCode, shift.getId());
            return Optional.empty();
        }
    }

    public Violation getViolation(Long companyId, Long violationId) {
        Violation violation = violationRepository.findById(violationId);
        if (violation == null) {
            throw new NotFoundException("Violation", violationId);
        }
        if (!violation.getCompanyId().equals(companyId)) {
            throw new ScopeMismatchException("Violation", violationId, companyId);
        }
        return violation;
    }

    /** Violations created in {@code [from, to)}, dates taken in the configured zone; null bounds are open. */
    public List<Violation> listByEmployee(Long companyId, Long employeeId, LocalDate from, LocalDate to) {
        Employee employee = employeeRepository.findById(employeeId);
        if (employee == null) {
            throw new NotFoundException("Employee", employeeId);
        }
        if (!employee.getCompanyId().equals(companyId)) {
            throw new ScopeMismatchException("Employee", employeeId, companyId);
        }
        checkRange(from, to);
        return violationRepository.listByEmployee(employeeId, toInstant(from), toInstant(to));
    }

    public List<Violation> listByCompany(Long companyId, LocalDate from, LocalDate to) {
        if (companyId == null) {
            throw new ValidationException("companyId is required");
        }
        checkRange(from, to);
        return violationRepository.listByCompany(companyId, toInstant(from), toInstant(to));
    }

    private Violation record(Long employeeId, Long companyId, Long ruleId, Long shiftId, ViolationSource source,
                             String reason, String createdBy) {
        if (employeeId == null || companyId == null || ruleId == null || source == null) {
            throw new ValidationException("employeeId, companyId, ruleId and source are required");
        }
        Employee employee = employeeRepository.findById(employeeId);
        if (employee == null) {
            throw new NotFoundException("Employee", employeeId);
        }
        ViolationRule rule = ruleRepository.findById(ruleId);
        if (rule == null) {
            throw new NotFoundException("Violation rule", ruleId);
        }
        if (!employee.getCompanyId().equals(companyId)) {
            throw new ScopeMismatchException("Employee", employeeId, companyId);
        }
        if (!rule.getCompanyId().equals(companyId)) {
            throw new ScopeMismatchException("Violation rule", ruleId, companyId);
        }
        if (!rule.isActive()) {
            throw new RuleInactiveException(ruleId);
        }

        Violation violation = new Violation();
        violation.setEmployeeId(employeeId);
        violation.setCompanyId(companyId);
        violation.setRuleId(ruleId);
        violation.setShiftId(shiftId);
        violation.setSource(source);
        violation.setPenalty(rule.getPenaltyPercent());
        violation.setReason(reason);
        violation.setCreatedBy(createdBy);
        violation.setCreatedAt(clock.instant());
        violationRepository.save(violation);
        log.info("Violation recorded: violationId={}, employeeId={}, rule={}, source={}, penalty={}",
                violation.getId(), employeeId, rule.getCode(), source, violation.getPenalty());

        try {
            ratingService.recalculateCurrentPeriod(employeeId);
        } catch (RuntimeException e) {
            log.warn("Rating recalculation after violation {} failed for employee {}", violation.getId(), employeeId, e);
        }
        changeNotifier.companyChanged(companyId);
        return violation;
    }

    private static void checkRange(LocalDate from, LocalDate to) {
        if (from != null && to != null && !to.isAfter(from)) {
            throw new ValidationException("'to' must be after 'from'");
        }
    }

    private Instant toInstant(LocalDate date) {
        return date == null ? null : date.atStartOfDay(properties.getZoneId()).toInstant();
    }
}
