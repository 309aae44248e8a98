package io.github.shiftlog.workforce.support;

import io.github.shiftlog.workforce.application.repository.EmployeeRepository;
import io.github.shiftlog.workforce.application.repository.ShiftRepository;
import io.github.shiftlog.workforce.domain.model.ShiftStatus;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Employee;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Shift;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

public class InMemoryShiftRepository implements ShiftRepository {

    private final Map<Long, Shift> rows = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final EmployeeRepository employees;

    public InMemoryShiftRepository(EmployeeRepository employees) {
        this.employees = employees;
    }

    @Override
    public Shift findById(Long id) {
        Shift s = rows.get(id);
        return s == null ? null : copy(s);
    }

    @Override
    public void save(Shift shift) {
        shift.setId(ids.incrementAndGet());
        rows.put(shift.getId(), copy(shift));
    }

    @Override
    public synchronized int updateStatus(Long id, ShiftStatus expected, ShiftStatus next,
                                         Instant actualStartAt, Instant actualEndAt) {
        Shift s = rows.get(id);
        if (s == null || s.getStatus() != expected) {
            return 0;
        }
        s.setStatus(next);
        if (actualStartAt != null) {
            s.setActualStartAt(actualStartAt);
        }
        if (actualEndAt != null) {
            s.setActualEndAt(actualEndAt);
        }
        return 1;
    }

    @Override
    public List<Shift> listActiveByCompany(Long companyId) {
        return rows.values().stream()
                .filter(s -> s.getStatus() == ShiftStatus.ACTIVE || s.getStatus() == ShiftStatus.PAUSED)
                .filter(s -> {
                    Employee e = employees.findById(s.getEmployeeId());
                    return e != null && e.getCompanyId().equals(companyId);
                })
                .map(InMemoryShiftRepository::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<Shift> listScheduledStartingBefore(Instant cutoff) {
        return rows.values().stream()
                .filter(s -> s.getStatus() == ShiftStatus.SCHEDULED && s.getPlannedStartAt().isBefore(cutoff))
                .sorted(Comparator.comparing(Shift::getPlannedStartAt))
                .map(InMemoryShiftRepository::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<Shift> listStartedSince(Instant since) {
        return rows.values().stream()
                .filter(s -> s.getActualStartAt() != null && !s.getActualStartAt().isBefore(since))
                .sorted(Comparator.comparing(Shift::getActualStartAt))
                .map(InMemoryShiftRepository::copy)
                .collect(Collectors.toList());
    }

    private static Shift copy(Shift src) {
        Shift s = new Shift();
        s.setId(src.getId());
        s.setEmployeeId(src.getEmployeeId());
        s.setPlannedStartAt(src.getPlannedStartAt());
        s.setPlannedEndAt(src.getPlannedEndAt());
        s.setActualStartAt(src.getActualStartAt());
        s.setActualEndAt(src.getActualEndAt());
        s.setStatus(src.getStatus());
        s.setCreatedAt(src.getCreatedAt());
        return s;
    }
}
