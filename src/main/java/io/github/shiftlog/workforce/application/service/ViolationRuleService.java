package io.github.shiftlog.workforce.application.service;

import io.github.shiftlog.workforce.application.repository.ViolationRuleRepository;
import io.github.shiftlog.workforce.domain.exception.ConflictException;
import io.github.shiftlog.workforce.domain.exception.NotFoundException;
import io.github.shiftlog.workforce.domain.exception.ScopeMismatchException;
import io.github.shiftlog.workforce.domain.exception.ValidationException;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.ViolationRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class ViolationRuleService {

    private static final BigDecimal MAX_PENALTY = BigDecimal.valueOf(100);

    private final ViolationRuleRepository ruleRepository;
    private final Clock clock;

    @Transactional
    public ViolationRule createRule(Long companyId, String code, String name, BigDecimal penaltyPercent,
                                    boolean autoDetectable) {
        if (companyId == null) {
            throw new ValidationException("companyId is required");
        }
        if (code == null || code.isBlank()) {
            throw new ValidationException("code is required");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("name is required");
        }
        validatePenalty(penaltyPercent);
        if (ruleRepository.findByCompanyAndCode(companyId, code.trim()) != null) {
            throw new ConflictException("violation rule with code '" + code.trim() + "' already exists");
        }

        ViolationRule rule = new ViolationRule();
        rule.setCompanyId(companyId);
        rule.setCode(code);
        rule.setName(name);
        rule.setPenaltyPercent(penaltyPercent);
        rule.setAutoDetectable(autoDetectable);
        rule.setActive(true);
        rule.setCreatedAt(clock.instant());
        try {
            ruleRepository.save(rule);
        } catch (DuplicateKeyException e) {
            throw new ConflictException("violation rule with code '" + rule.getCode() + "' already exists");
        }
        log.info("Violation rule created: ruleId={}, companyId={}, code={}, penalty={}",
                rule.getId(), companyId, rule.getCode(), penaltyPercent);
        return rule;
    }

    /**
     * Partial update; null arguments keep the stored value. Existing violations keep their
     * penalty snapshot whatever happens to the rule here.
     */
    @Transactional
    public ViolationRule updateRule(Long companyId, Long ruleId, String name, BigDecimal penaltyPercent,
                                    Boolean autoDetectable, Boolean active) {
        ViolationRule rule = getRule(companyId, ruleId);
        if (name != null) {
            if (name.isBlank()) {
                throw new ValidationException("name must not be blank");
            }
            rule.setName(name);
        }
        if (penaltyPercent != null) {
            validatePenalty(penaltyPercent);
            rule.setPenaltyPercent(penaltyPercent);
        }
        if (autoDetectable != null) {
            rule.setAutoDetectable(autoDetectable);
        }
        if (active != null) {
            rule.setActive(active);
        }
        ruleRepository.update(rule);
        log.info("Violation rule updated: ruleId={}, penalty={}, active={}", ruleId, rule.getPenaltyPercent(), rule.isActive());
        return rule;
    }

    /** Soft delete; rules stay referenced by past violations. */
    @Transactional
    public ViolationRule deactivateRule(Long companyId, Long ruleId) {
        return updateRule(companyId, ruleId, null, null, null, false);
    }

    public ViolationRule getRule(Long companyId, Long ruleId) {
        ViolationRule rule = ruleRepository.findById(ruleId);
        if (rule == null) {
            throw new NotFoundException("Violation rule", ruleId);
        }
        if (!rule.getCompanyId().equals(companyId)) {
            throw new ScopeMismatchException("Violation rule", ruleId, companyId);
        }
        return rule;
    }

    public List<ViolationRule> listRules(Long companyId) {
        return ruleRepository.listByCompany(companyId);
    }

    private static void validatePenalty(BigDecimal penaltyPercent) {
        if (penaltyPercent == null) {
            throw new ValidationException("penaltyPercent is required");
        }
        if (penaltyPercent.signum() < 0 || penaltyPercent.compareTo(MAX_PENALTY) > 0) {
            throw new ValidationException("penaltyPercent must be between 0 and 100");
        }
    }
}
