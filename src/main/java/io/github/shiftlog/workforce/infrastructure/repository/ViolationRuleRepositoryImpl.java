package io.github.shiftlog.workforce.infrastructure.repository;

import io.github.shiftlog.workforce.application.repository.ViolationRuleRepository;
import io.github.shiftlog.workforce.infrastructure.mapper.ViolationRuleMapper;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.ViolationRule;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class ViolationRuleRepositoryImpl implements ViolationRuleRepository {

    private final ViolationRuleMapper mapper;

    public ViolationRuleRepositoryImpl(ViolationRuleMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public ViolationRule findById(Long id) {
        return mapper.selectByPrimaryKey(id);
    }

    @Override
    public ViolationRule findByCompanyAndCode(Long companyId, String code) {
        return mapper.selectByCompanyAndCode(companyId, code);
    }

    @Override
    public void save(ViolationRule rule) {
        mapper.insert(rule);
    }

    @Override
    public void update(ViolationRule rule) {
        mapper.updateByPrimaryKey(rule);
    }

    @Override
    public List<ViolationRule> listByCompany(Long companyId) {
        return mapper.selectByCompany(companyId);
    }
}
