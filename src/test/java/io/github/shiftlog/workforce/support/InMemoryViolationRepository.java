package io.github.shiftlog.workforce.support;

import io.github.shiftlog.workforce.application.repository.ViolationRepository;
import io.github.shiftlog.workforce.domain.model.ViolationSource;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Violation;
import org.springframework.dao.DuplicateKeyException;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.stream.Collectors;

public class InMemoryViolationRepository implements ViolationRepository {

    private final Map<Long, Violation> rows = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    /** Inserts a violation directly, bypassing the recorder. */
    public Violation add(Long employeeId, Long companyId, Long ruleId, String penalty, Instant createdAt) {
        Violation v = new Violation();
        v.setEmployeeId(employeeId);
        v.setCompanyId(companyId);
        v.setRuleId(ruleId);
        v.setSource(ViolationSource.MANUAL);
        v.setPenalty(new BigDecimal(penalty));
        v.setCreatedAt(createdAt);
        save(v);
        return v;
    }

    @Override
    public Violation findById(Long id) {
        Violation v = rows.get(id);
        return v == null ? null : copy(v);
    }

    @Override
    public synchronized void save(Violation violation) {
        if (violation.getSource() == ViolationSource.AUTO && violation.getShiftId() != null
                && existsByShiftAndRule(violation.getShiftId(), violation.getRuleId())) {
            throw new DuplicateKeyException("uq_violation_auto_shift_rule");
        }
        violation.setId(ids.incrementAndGet());
        rows.put(violation.getId(), copy(violation));
    }

    @Override
    public List<Violation> listByEmployee(Long employeeId, Instant from, Instant to) {
        return list(v -> v.getEmployeeId().equals(employeeId), from, to);
    }

    @Override
    public List<Violation> listByCompany(Long companyId, Instant from, Instant to) {
        return list(v -> v.getCompanyId().equals(companyId), from, to);
    }

    @Override
    public boolean existsByShiftAndRule(Long shiftId, Long ruleId) {
        return rows.values().stream().anyMatch(v -> v.getSource() == ViolationSource.AUTO
                && shiftId.equals(v.getShiftId()) && ruleId.equals(v.getRuleId()));
    }

    public int count() {
        return rows.size();
    }

    private List<Violation> list(Predicate<Violation> filter, Instant from, Instant to) {
        return rows.values().stream()
                .filter(filter)
                .filter(v -> from == null || !v.getCreatedAt().isBefore(from))
                .filter(v -> to == null || v.getCreatedAt().isBefore(to))
                .sorted(Comparator.comparing(Violation::getCreatedAt))
                .map(InMemoryViolationRepository::copy)
                .collect(Collectors.toList());
    }

    private static Violation copy(Violation src) {
        Violation v = new Violation();
        v.setId(src.getId());
        v.setEmployeeId(src.getEmployeeId());
        v.setCompanyId(src.getCompanyId());
        v.setRuleId(src.getRuleId());
        v.setShiftId(src.getShiftId());
        v.setSource(src.getSource());
        v.setPenalty(src.getPenalty());
        v.setReason(src.getReason());
        v.setCreatedBy(src.getCreatedBy());
        v.setCreatedAt(src.getCreatedAt());
        return v;
    }
}
