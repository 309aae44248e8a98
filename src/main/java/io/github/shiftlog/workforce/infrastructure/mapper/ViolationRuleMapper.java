package io.github.shiftlog.workforce.infrastructure.mapper;

import io.github.shiftlog.workforce.infrastructure.persistence.entity.ViolationRule;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface ViolationRuleMapper {
    ViolationRule selectByPrimaryKey(@Param("id") Long id);

    ViolationRule selectByCompanyAndCode(@Param("companyId") Long companyId, @Param("code") String code);

    int insert(ViolationRule row);

    int updateByPrimaryKey(ViolationRule row);

    List<ViolationRule> selectByCompany(@Param("companyId") Long companyId);
}
