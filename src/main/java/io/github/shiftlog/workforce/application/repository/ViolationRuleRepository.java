package io.github.shiftlog.workforce.application.repository;

import io.github.shiftlog.workforce.infrastructure.persistence.entity.ViolationRule;

import java.util.List;

public interface ViolationRuleRepository {
    ViolationRule findById(Long id);

    ViolationRule findByCompanyAndCode(Long companyId, String code);

    void save(ViolationRule rule);

    void update(ViolationRule rule);

    List<ViolationRule> listByCompany(Long companyId);
}
