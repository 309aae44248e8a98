package io.github.shiftlog.workforce.infrastructure.repository;

import io.github.shiftlog.workforce.application.repository.EmployeeInviteRepository;
import io.github.shiftlog.workforce.infrastructure.mapper.EmployeeInviteMapper;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.EmployeeInvite;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class EmployeeInviteRepositoryImpl implements EmployeeInviteRepository {

    private final EmployeeInviteMapper mapper;

    public EmployeeInviteRepositoryImpl(EmployeeInviteMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void save(EmployeeInvite invite) {
        mapper.insert(invite);
    }

    @Override
    public EmployeeInvite findByCode(String code) {
        return mapper.selectByCode(code);
    }

    @Override
    public List<EmployeeInvite> listByCompany(Long companyId) {
        return mapper.selectByCompany(companyId);
    }

    @Override
    public int claim(String code, Instant usedAt) {
        return mapper.claimUnused(code, usedAt);
    }

    @Override
    public int assignEmployee(Long inviteId, Long employeeId) {
        return mapper.updateUsedBy(inviteId, employeeId);
    }

    @Override
    public int deleteExpiredUnused(Instant now, Instant createdBefore) {
        return mapper.deleteExpiredUnused(now, createdBefore);
    }
}
