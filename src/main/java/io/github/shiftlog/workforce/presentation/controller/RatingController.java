package io.github.shiftlog.workforce.presentation.controller;

import io.github.shiftlog.workforce.application.service.RatingService;
import io.github.shiftlog.workforce.domain.model.RatingPeriod;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.EmployeeRating;
import io.github.shiftlog.workforce.presentation.form.RatingAdjustForm;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;

/**
 * Period parameters are ISO dates forming a half-open range; omitting both means the current month.
 */
@RestController
@RequestMapping(path = "/api/ratings", produces = MediaType.APPLICATION_JSON_VALUE)
@RequiredArgsConstructor
public class RatingController {

    private final RatingService ratingService;

    @PostMapping("/employees/{employeeId}/recalculate")
    public EmployeeRating recalculate(@PathVariable Long employeeId,
                                      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate periodStart,
                                      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate periodEnd) {
        if (periodStart == null && periodEnd == null) {
            return ratingService.recalculateCurrentPeriod(employeeId);
        }
        return ratingService.recalculate(employeeId, periodStart, periodEnd);
    }

    @PostMapping(path = "/employees/{employeeId}/adjust", consumes = MediaType.APPLICATION_JSON_VALUE)
    public EmployeeRating adjust(@PathVariable Long employeeId, @Valid @RequestBody RatingAdjustForm form) {
        return ratingService.adjustRating(employeeId, form.getDelta(), form.getPeriodStart(), form.getPeriodEnd());
    }

    @GetMapping("/employees/{employeeId}/current")
    public EmployeeRating current(@PathVariable Long employeeId) {
        return ratingService.getCurrentPeriod(employeeId);
    }

    @GetMapping("/employees/{employeeId}")
    public EmployeeRating forPeriod(@PathVariable Long employeeId,
                                    @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate periodStart,
                                    @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate periodEnd) {
        return ratingService.getForPeriod(employeeId, periodStart, periodEnd);
    }

    @PostMapping("/companies/{companyId}/recalculate")
    public List<EmployeeRating> recalculateCompany(@PathVariable Long companyId,
                                                   @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate periodStart,
                                                   @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate periodEnd) {
        return ratingService.recalculateCompany(companyId, periodStart, periodEnd);
    }

    @GetMapping("/companies/{companyId}")
    public List<EmployeeRating> listCompany(@PathVariable Long companyId,
                                            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate periodStart,
                                            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate periodEnd) {
        return ratingService.listCompanyRatings(companyId, periodStart, periodEnd);
    }

    @GetMapping("/period/current")
    public RatingPeriod currentPeriod() {
        return ratingService.currentPeriod();
    }
}
