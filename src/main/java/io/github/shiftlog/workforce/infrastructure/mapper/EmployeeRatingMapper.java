package io.github.shiftlog.workforce.infrastructure.mapper;

import io.github.shiftlog.workforce.infrastructure.persistence.entity.EmployeeRating;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.LocalDate;
import java.util.List;

@Mapper
public interface EmployeeRatingMapper {
    EmployeeRating selectByEmployeeAndPeriod(@Param("employeeId") Long employeeId,
                                             @Param("periodStart") LocalDate periodStart,
                                             @Param("periodEnd") LocalDate periodEnd);

    EmployeeRating selectByEmployeeAndPeriodForUpdate(@Param("employeeId") Long employeeId,
                                                      @Param("periodStart") LocalDate periodStart,
                                                      @Param("periodEnd") LocalDate periodEnd);

    int insertIfAbsent(EmployeeRating row);

    int upsert(EmployeeRating row);

    List<EmployeeRating> selectByCompanyAndPeriod(@Param("companyId") Long companyId,
                                                  @Param("periodStart") LocalDate periodStart,
                                                  @Param("periodEnd") LocalDate periodEnd);
}
