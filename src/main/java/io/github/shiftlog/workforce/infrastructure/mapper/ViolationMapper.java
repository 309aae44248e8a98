package io.github.shiftlog.workforce.infrastructure.mapper;

import io.github.shiftlog.workforce.infrastructure.persistence.entity.Violation;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;
import java.util.List;

@Mapper
public interface ViolationMapper {
    Violation selectByPrimaryKey(@Param("id") Long id);

    int insert(Violation row);

    List<Violation> selectByEmployee(@Param("employeeId") Long employeeId,
                                     @Param("from") Instant from,
                                     @Param("to") Instant to);

    List<Violation> selectByCompany(@Param("companyId") Long companyId,
                                    @Param("from") Instant from,
                                    @Param("to") Instant to);

    int countByShiftAndRule(@Param("shiftId") Long shiftId, @Param("ruleId") Long ruleId);
}
