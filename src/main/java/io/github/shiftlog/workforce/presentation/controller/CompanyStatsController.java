package io.github.shiftlog.workforce.presentation.controller;

import io.github.shiftlog.workforce.application.dto.CompanyStats;
import io.github.shiftlog.workforce.application.service.CompanyStatsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class CompanyStatsController {

    private final CompanyStatsService statsService;

    @GetMapping(path = "/api/companies/{companyId}/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public CompanyStats stats(@PathVariable Long companyId) {
        return statsService.getStats(companyId);
    }
}
