package io.github.shiftlog.workforce.infrastructure.mapper;

import io.github.shiftlog.workforce.infrastructure.persistence.entity.BreakInterval;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;
import java.util.List;

@Mapper
public interface BreakIntervalMapper {
    int insertIfNoneOpen(BreakInterval row);

    int closeOpen(@Param("shiftId") Long shiftId, @Param("endAt") Instant endAt);

    BreakInterval selectOpen(@Param("shiftId") Long shiftId);

    List<BreakInterval> selectByShift(@Param("shiftId") Long shiftId);
}
