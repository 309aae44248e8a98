package io.github.shiftlog.workforce.infrastructure.mapper;

import io.github.shiftlog.workforce.infrastructure.persistence.entity.Employee;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface EmployeeMapper {
    Employee selectByPrimaryKey(@Param("id") Long id);

    Employee selectByTelegramUserId(@Param("telegramUserId") String telegramUserId);

    int insert(Employee row);

    int updateByPrimaryKey(Employee row);

    List<Employee> selectByCompany(@Param("companyId") Long companyId);
}
