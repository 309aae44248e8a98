package io.github.shiftlog.workforce.presentation.controller;

import io.github.shiftlog.workforce.application.dto.ShiftDetail;
import io.github.shiftlog.workforce.application.service.ShiftLifecycleService;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Shift;
import io.github.shiftlog.workforce.presentation.form.ShiftCreateForm;
import io.github.shiftlog.workforce.presentation.form.ShiftPauseForm;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
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

import java.util.List;

@RestController
@RequestMapping(path = "/api/shifts", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class ShiftController {

    private final ShiftLifecycleService shiftService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Shift> create(@Valid @RequestBody ShiftCreateForm form) {
        Shift shift = shiftService.createShift(form.getEmployeeId(), form.getPlannedStartAt(), form.getPlannedEndAt());
        return ResponseEntity.status(HttpStatus.CREATED).body(shift);
    }

    @GetMapping("/{shiftId}")
    public ShiftDetail get(@PathVariable Long shiftId) {
        return shiftService.getShiftDetail(shiftId);
    }

    @GetMapping("/active")
    public List<Shift> listActive(@RequestParam("companyId") Long companyId) {
        return shiftService.listActiveByCompany(companyId);
    }

    @PostMapping("/{shiftId}/start")
    public Shift start(@PathVariable Long shiftId) {
        return shiftService.start(shiftId);
    }

    @PostMapping("/{shiftId}/pause")
    public Shift pause(@PathVariable Long shiftId, @RequestBody(required = false) ShiftPauseForm form) {
        return shiftService.pause(shiftId, form == null ? null : form.getKind());
    }

    @PostMapping("/{shiftId}/resume")
    public Shift resume(@PathVariable Long shiftId) {
        return shiftService.resume(shiftId);
    }

    @PostMapping("/{shiftId}/end")
    public Shift end(@PathVariable Long shiftId) {
        return shiftService.end(shiftId);
    }

    @PostMapping("/{shiftId}/cancel")
    public Shift cancel(@PathVariable Long shiftId) {
        return shiftService.cancel(shiftId);
    }
}
