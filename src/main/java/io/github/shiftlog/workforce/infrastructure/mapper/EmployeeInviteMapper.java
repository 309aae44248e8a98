package io.github.shiftlog.workforce.infrastructure.mapper;

import io.github.shiftlog.workforce.infrastructure.persistence.entity.EmployeeInvite;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;
import java.util.List;

@Mapper
public interface EmployeeInviteMapper {
    int insert(EmployeeInvite row);

    EmployeeInvite selectByCode(@Param("code") String code);

    List<EmployeeInvite> selectByCompany(@Param("companyId") Long companyId);

    int claimUnused(@Param("code") String code, @Param("usedAt") Instant usedAt);

    int updateUsedBy(@Param("id") Long id, @Param("employeeId") Long employeeId);

    int deleteExpiredUnused(@Param("now") Instant now, @Param("createdBefore") Instant createdBefore);
}
