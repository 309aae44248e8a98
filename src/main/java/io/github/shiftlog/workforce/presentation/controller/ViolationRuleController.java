package io.github.shiftlog.workforce.presentation.controller;

import io.github.shiftlog.workforce.application.service.ViolationRuleService;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.ViolationRule;
import io.github.shiftlog.workforce.presentation.form.ViolationRuleForm;
import io.github.shiftlog.workforce.presentation.form.ViolationRuleUpdateForm;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping(path = "/api/companies/{companyId}/violation-rules", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class ViolationRuleController {

    private final ViolationRuleService ruleService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ViolationRule> create(@PathVariable Long companyId, @Valid @RequestBody ViolationRuleForm form) {
        ViolationRule rule = ruleService.createRule(companyId, form.getCode(), form.getName(),
                form.getPenaltyPercent(), form.isAutoDetectable());
        return ResponseEntity.status(HttpStatus.CREATED).body(rule);
    }

    @GetMapping
    public List<ViolationRule> list(@PathVariable Long companyId) {
        return ruleService.listRules(companyId);
    }

    @GetMapping("/{ruleId}")
    public ViolationRule get(@PathVariable Long companyId, @PathVariable Long ruleId) {
        return ruleService.getRule(companyId, ruleId);
    }

    @PatchMapping(path = "/{ruleId}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ViolationRule update(@PathVariable Long companyId, @PathVariable Long ruleId,
                                @Valid @RequestBody ViolationRuleUpdateForm form) {
        return ruleService.updateRule(companyId, ruleId, form.getName(), form.getPenaltyPercent(),
                form.getAutoDetectable(), form.getActive());
    }

    @DeleteMapping("/{ruleId}")
    public ViolationRule deactivate(@PathVariable Long companyId, @PathVariable Long ruleId) {
        return ruleService.deactivateRule(companyId, ruleId);
    }
}
