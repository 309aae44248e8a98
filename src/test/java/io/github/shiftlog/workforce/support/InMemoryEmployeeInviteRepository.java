package io.github.shiftlog.workforce.support;

import io.github.shiftlog.workforce.application.repository.EmployeeInviteRepository;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.EmployeeInvite;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

public class InMemoryEmployeeInviteRepository implements EmployeeInviteRepository {

    private final Map<String, EmployeeInvite> rows = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public synchronized void save(EmployeeInvite invite) {
        if (rows.containsKey(invite.getCode())) {
            throw new DuplicateKeyException("employee_invite.code");
        }
        invite.setId(ids.incrementAndGet());
        rows.put(invite.getCode(), copy(invite));
    }

    @Override
    public EmployeeInvite findByCode(String code) {
        EmployeeInvite i = rows.get(code);
        return i == null ? null : copy(i);
    }

    @Override
    public List<EmployeeInvite> listByCompany(Long companyId) {
        return rows.values().stream()
                .filter(i -> i.getCompanyId().equals(companyId))
                .map(InMemoryEmployeeInviteRepository::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized int claim(String code, Instant usedAt) {
        EmployeeInvite i = rows.get(code);
        if (i == null || i.isUsed()) {
            return 0;
        }
        i.setUsedAt(usedAt);
        return 1;
    }

    @Override
    public synchronized int assignEmployee(Long inviteId, Long employeeId) {
        for (EmployeeInvite i : rows.values()) {
            if (i.getId().equals(inviteId)) {
                i.setUsedByEmployee(employeeId);
                return 1;
            }
        }
        return 0;
    }

    @Override
    public synchronized int deleteExpiredUnused(Instant now, Instant createdBefore) {
        List<String> doomed = rows.values().stream()
                .filter(i -> !i.isUsed())
                .filter(i -> (i.getExpiresAt() != null && i.getExpiresAt().isBefore(now))
                        || i.getCreatedAt().isBefore(createdBefore))
                .map(EmployeeInvite::getCode)
                .collect(Collectors.toList());
        doomed.forEach(rows::remove);
        return doomed.size();
    }

    private static EmployeeInvite copy(EmployeeInvite src) {
        EmployeeInvite i = new EmployeeInvite();
        i.setId(src.getId());
        i.setCompanyId(src.getCompanyId());
        i.setCode(src.getCode());
        i.setFullName(src.getFullName());
        i.setPosition(src.getPosition());
        i.setCreatedAt(src.getCreatedAt());
        i.setExpiresAt(src.getExpiresAt());
        i.setUsedByEmployee(src.getUsedByEmployee());
        i.setUsedAt(src.getUsedAt());
        return i;
    }
}
