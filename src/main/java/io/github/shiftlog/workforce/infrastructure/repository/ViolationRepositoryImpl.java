package io.github.shiftlog.workforce.infrastructure.repository;

import io.github.shiftlog.workforce.application.repository.ViolationRepository;
import io.github.shiftlog.workforce.infrastructure.mapper.ViolationMapper;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Violation;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public class ViolationRepositoryImpl implements ViolationRepository {

    private final ViolationMapper mapper;

    public ViolationRepositoryImpl(ViolationMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public Violation findById(Long id) {
        return mapper.selectByPrimaryKey(id);
    }

    @Override
    public void save(Violation violation) {
        mapper.insert(violation);
    }

    @Override
    public List<Violation> listByEmployee(Long employeeId, Instant from, Instant to) {
        return mapper.selectByEmployee(employeeId, from, to);
    }

    @Override
    public List<Violation> listByCompany(Long companyId, Instant from, Instant to) {
        return mapper.selectByCompany(companyId, from, to);
    }

    @Override
    public boolean existsByShiftAndRule(Long shiftId, Long ruleId) {
        return mapper.countByShiftAndRule(shiftId, ruleId) > 0;
    }
}
