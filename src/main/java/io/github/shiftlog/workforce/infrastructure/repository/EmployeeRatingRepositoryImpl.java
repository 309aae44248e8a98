package io.github.shiftlog.workforce.infrastructure.repository;

import io.github.shiftlog.workforce.application.repository.EmployeeRatingRepository;
import io.github.shiftlog.workforce.infrastructure.mapper.EmployeeRatingMapper;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.EmployeeRating;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public class EmployeeRatingRepositoryImpl implements EmployeeRatingRepository {

    private final EmployeeRatingMapper mapper;

    public EmployeeRatingRepositoryImpl(EmployeeRatingMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public EmployeeRating findByEmployeeAndPeriod(Long employeeId, LocalDate periodStart, LocalDate periodEnd) {
        return mapper.selectByEmployeeAndPeriod(employeeId, periodStart, periodEnd);
    }

    @Override
    public EmployeeRating lockOrCreate(EmployeeRating initial) {
        mapper.insertIfAbsent(initial);
        return mapper.selectByEmployeeAndPeriodForUpdate(
                initial.getEmployeeId(), initial.getPeriodStart(), initial.getPeriodEnd());
    }

    @Override
    public void upsert(EmployeeRating rating) {
        mapper.upsert(rating);
    }

    @Override
    public List<EmployeeRating> listByCompanyAndPeriod(Long companyId, LocalDate periodStart, LocalDate periodEnd) {
        return mapper.selectByCompanyAndPeriod(companyId, periodStart, periodEnd);
    }
}
