package io.github.shiftlog.workforce.presentation.controller;

import io.github.shiftlog.workforce.application.service.ViolationService;
import io.github.shiftlog.workforce.domain.model.ViolationSource;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Violation;
import io.github.shiftlog.workforce.presentation.form.ViolationCreateForm;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping(path = "/api/companies/{companyId}/violations", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class ViolationController {

    private final ViolationService violationService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Violation> record(@PathVariable Long companyId, @Valid @RequestBody ViolationCreateForm form) {
        ViolationSource source = form.getSource() == null ? ViolationSource.MANUAL : form.getSource();
        Violation violation = violationService.recordViolation(form.getEmployeeId(), companyId, form.getRuleId(),
                source, form.getReason(), form.getCreatedBy());
        return ResponseEntity.status(HttpStatus.CREATED).body(violation);
    }

    @GetMapping
    public List<Violation> listByCompany(@PathVariable Long companyId,
                                         @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                         @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return violationService.listByCompany(companyId, from, to);
    }

    @GetMapping("/{violationId}")
    public Violation get(@PathVariable Long companyId, @PathVariable Long violationId) {
        return violationService.getViolation(companyId, violationId);
    }

    @GetMapping("/employees/{employeeId}")
    public List<Violation> listByEmployee(@PathVariable Long companyId,
                                          @PathVariable Long employeeId,
                                          @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                                          @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        return violationService.listByEmployee(companyId, employeeId, from, to);
    }
}
