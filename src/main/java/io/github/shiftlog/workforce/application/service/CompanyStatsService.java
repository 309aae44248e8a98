package io.github.shiftlog.workforce.application.service;

import io.github.shiftlog.workforce.application.dto.CompanyStats;
import io.github.shiftlog.workforce.application.repository.EmployeeRatingRepository;
import io.github.shiftlog.workforce.application.repository.EmployeeRepository;
import io.github.shiftlog.workforce.application.repository.ShiftRepository;
import io.github.shiftlog.workforce.application.repository.ViolationRepository;
import io.github.shiftlog.workforce.config.CacheConfig;
import io.github.shiftlog.workforce.config.WorkforceProperties;
import io.github.shiftlog.workforce.domain.exception.ValidationException;
import io.github.shiftlog.workforce.domain.model.RatingPeriod;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.EmployeeRating;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.ZoneId;
import java.util.List;

/**
 * Read model for the company dashboard. Entries are evicted by {@code CompanyChangeNotifier}
 * whenever shifts, violations, ratings or employees of the company change.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CompanyStatsService {

    private final EmployeeRepository employeeRepository;
    private final ShiftRepository shiftRepository;
    private final ViolationRepository violationRepository;
    private final EmployeeRatingRepository ratingRepository;
    private final WorkforceProperties properties;
    private final Clock clock;

    @Cacheable(cacheNames = CacheConfig.COMPANY_STATS, key = "#companyId")
    public CompanyStats getStats(Long companyId) {
        if (companyId == null) {
            throw new ValidationException("companyId is required");
        }
        ZoneId zone = properties.getZoneId();
        RatingPeriod period = RatingPeriod.current(clock, zone);
        int employees = employeeRepository.listByCompany(companyId).size();
        int activeShifts = shiftRepository.listActiveByCompany(companyId).size();
        int violations = violationRepository
                .listByCompany(companyId, period.startInstant(zone), period.endInstant(zone)).size();
        BigDecimal average = average(ratingRepository.listByCompanyAndPeriod(companyId, period.start(), period.end()));
        log.debug("Stats computed for company {}: employees={}, activeShifts={}, violations={}",
                companyId, employees, activeShifts, violations);
        return new CompanyStats(companyId, employees, activeShifts, violations, average, period.start(), period.end());
    }

    private static BigDecimal average(List<EmployeeRating> ratings) {
        if (ratings.isEmpty()) {
            return null;
        }
        BigDecimal sum = ratings.stream().map(EmployeeRating::getRating).reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(ratings.size()), 2, RoundingMode.HALF_UP);
    }
}
