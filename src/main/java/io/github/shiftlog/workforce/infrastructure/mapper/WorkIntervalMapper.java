package io.github.shiftlog.workforce.infrastructure.mapper;

import io.github.shiftlog.workforce.infrastructure.persistence.entity.WorkInterval;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;
import java.util.List;

@Mapper
public interface WorkIntervalMapper {
    int insertIfNoneOpen(WorkInterval row);

    int closeOpen(@Param("shiftId") Long shiftId, @Param("endAt") Instant endAt);

    WorkInterval selectOpen(@Param("shiftId") Long shiftId);

    List<WorkInterval> selectByShift(@Param("shiftId") Long shiftId);
}
