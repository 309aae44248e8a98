package io.github.shiftlog.workforce.application.service;

import io.github.shiftlog.workforce.application.cache.CompanyChangeNotifier;
import io.github.shiftlog.workforce.application.dto.ShiftDetail;
import io.github.shiftlog.workforce.application.repository.EmployeeRepository;
import io.github.shiftlog.workforce.application.repository.ShiftRepository;
import io.github.shiftlog.workforce.domain.exception.InvalidStateTransitionException;
import io.github.shiftlog.workforce.domain.exception.NotFoundException;
import io.github.shiftlog.workforce.domain.exception.ValidationException;
import io.github.shiftlog.workforce.domain.model.BreakKind;
import io.github.shiftlog.workforce.domain.model.ShiftStatus;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Employee;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Shift;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Shift state machine.
 * <pre>
 *   SCHEDULED --start--> ACTIVE --pause--> PAUSED --resume--> ACTIVE
 *   ACTIVE|PAUSED --end--> COMPLETED
 *   SCHEDULED|ACTIVE|PAUSED --cancel--> CANCELLED
 * </pre>
 * Every transition runs in one transaction: the status compare-and-set goes first (it also locks
 * the shift row), interval changes follow, and any failure rolls both back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShiftLifecycleService {

    private static final Set<ShiftStatus> FROM_SCHEDULED = EnumSet.of(ShiftStatus.SCHEDULED);
    private static final Set<ShiftStatus> FROM_ACTIVE = EnumSet.of(ShiftStatus.ACTIVE);
    private static final Set<ShiftStatus> FROM_PAUSED = EnumSet.of(ShiftStatus.PAUSED);
    private static final Set<ShiftStatus> FROM_RUNNING = EnumSet.of(ShiftStatus.ACTIVE, ShiftStatus.PAUSED);
    private static final Set<ShiftStatus> FROM_OPEN =
            EnumSet.of(ShiftStatus.SCHEDULED, ShiftStatus.ACTIVE, ShiftStatus.PAUSED);

    private final ShiftRepository shiftRepository;
    private final EmployeeRepository employeeRepository;
    private final IntervalTrackerService intervalTracker;
    private final CompanyChangeNotifier changeNotifier;
    private final Clock clock;

    @Transactional
    public Shift createShift(Long employeeId, Instant plannedStartAt, Instant plannedEndAt) {
        if (employeeId == null || plannedStartAt == null || plannedEndAt == null) {
            throw new ValidationException("employeeId, plannedStartAt and plannedEndAt are required");
        }
        if (!plannedEndAt.isAfter(plannedStartAt)) {
            throw new ValidationException("plannedEndAt must be after plannedStartAt");
        }
        Employee employee = employeeRepository.findById(employeeId);
        if (employee == null) {
            throw new NotFoundException("Employee", employeeId);
        }

        Shift shift = new Shift();
        shift.setEmployeeId(employeeId);
        shift.setPlannedStartAt(plannedStartAt);
        shift.setPlannedEndAt(plannedEndAt);
        shift.setStatus(ShiftStatus.SCHEDULED);
        shift.setCreatedAt(clock.instant());
        shiftRepository.save(shift);

        log.info("Shift created: shiftId={}, employeeId={}, planned={}..{}",
                shift.getId(), employeeId, plannedStartAt, plannedEndAt);
        changeNotifier.companyChanged(employee.getCompanyId());
        return shift;
    }

    public Shift getShift(Long shiftId) {
        Shift shift = shiftRepository.findById(shiftId);
        if (shift == null) {
            throw new NotFoundException("Shift", shiftId);
        }
        return shift;
    }

    public ShiftDetail getShiftDetail(Long shiftId) {
        Shift shift = getShift(shiftId);
        var work = intervalTracker.workIntervals(shiftId);
        var breaks = intervalTracker.breakIntervals(shiftId);
        long net = IntervalTrackerService.netWorked(work, breaks, null).toMinutes();
        return new ShiftDetail(shift, work, breaks, net);
    }

    public List<Shift> listActiveByCompany(Long companyId) {
        if (companyId == null) {
            throw new ValidationException("companyId is required");
        }
        return shiftRepository.listActiveByCompany(companyId);
    }

    @Transactional
    public Shift start(Long shiftId) {
        Instant now = clock.instant();
        Shift shift = transition(shiftId, "start", FROM_SCHEDULED, ShiftStatus.ACTIVE, now, null);
        intervalTracker.openWorkInterval(shiftId, now);
        return completed(shift, "started");
    }

    @Transactional
    public Shift pause(Long shiftId, BreakKind kind) {
        Instant now = clock.instant();
        Shift shift = transition(shiftId, "pause", FROM_ACTIVE, ShiftStatus.PAUSED, null, null);
        intervalTracker.closeOpenWorkInterval(shiftId, now);
        intervalTracker.openBreakInterval(shiftId, now, kind);
        return completed(shift, "paused");
    }

    @Transactional
    public Shift resume(Long shiftId) {
        Instant now = clock.instant();
        Shift shift = transition(shiftId, "resume", FROM_PAUSED, ShiftStatus.ACTIVE, null, null);
        intervalTracker.closeOpenBreakInterval(shiftId, now);
        intervalTracker.openWorkInterval(shiftId, now);
        return completed(shift, "resumed");
    }

    @Transactional
    public Shift end(Long shiftId) {
        Instant now = clock.instant();
        Shift shift = transition(shiftId, "end", FROM_RUNNING, ShiftStatus.COMPLETED, null, now);
        closeAll(shiftId, now);
        return completed(shift, "ended");
    }

    @Transactional
    public Shift cancel(Long shiftId) {
        Instant now = clock.instant();
        Shift shift = transition(shiftId, "cancel", FROM_OPEN, ShiftStatus.CANCELLED, null, null);
        closeAll(shiftId, now);
        return completed(shift, "cancelled");
    }

    private void closeAll(Long shiftId, Instant at) {
        intervalTracker.closeOpenWorkInterval(shiftId, at);
        intervalTracker.closeOpenBreakInterval(shiftId, at);
    }

    /**
     * Applies the status change with a compare-and-set on the status read here. Losing the race to
     * another request is reported as an invalid transition from whatever state won.
     */
    private Shift transition(Long shiftId, String name, Set<ShiftStatus> allowedFrom, ShiftStatus next,
                             Instant actualStartAt, Instant actualEndAt) {
        Shift shift = getShift(shiftId);
        ShiftStatus current = shift.getStatus();
        if (!allowedFrom.contains(current)) {
            throw new InvalidStateTransitionException(name, current);
        }
        int updated = shiftRepository.updateStatus(shiftId, current, next, actualStartAt, actualEndAt);
        if (updated == 0) {
            Shift latest = shiftRepository.findById(shiftId);
            if (latest == null) {
                throw new NotFoundException("Shift", shiftId);
            }
            log.warn("Shift {} changed concurrently: expected {}, found {}", shiftId, current, latest.getStatus());
            throw new InvalidStateTransitionException(name, latest.getStatus());
        }
        shift.setStatus(next);
        if (actualStartAt != null) {
            shift.setActualStartAt(actualStartAt);
        }
        if (actualEndAt != null) {
            shift.setActualEndAt(actualEndAt);
        }
        return shift;
    }

    private Shift completed(Shift shift, String verb) {
        log.info("Shift {}: shiftId={}, employeeId={}, status={}", verb, shift.getId(), shift.getEmployeeId(), shift.getStatus());
        Employee employee = employeeRepository.findById(shift.getEmployeeId());
        if (employee != null) {
            changeNotifier.companyChanged(employee.getCompanyId());
        }
        return shift;
    }
}
