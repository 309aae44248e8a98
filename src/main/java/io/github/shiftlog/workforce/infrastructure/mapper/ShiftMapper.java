package io.github.shiftlog.workforce.infrastructure.mapper;

import io.github.shiftlog.workforce.domain.model.ShiftStatus;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Shift;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;
import java.util.List;

@Mapper
public interface ShiftMapper {
    Shift selectByPrimaryKey(@Param("id") Long id);

    int insert(Shift row);

    int updateStatusIfCurrent(@Param("id") Long id,
                              @Param("expected") ShiftStatus expected,
                              @Param("next") ShiftStatus next,
                              @Param("actualStartAt") Instant actualStartAt,
                              @Param("actualEndAt") Instant actualEndAt);

    List<Shift> selectActiveByCompany(@Param("companyId") Long companyId);

    List<Shift> selectScheduledStartingBefore(@Param("cutoff") Instant cutoff);

    List<Shift> selectStartedSince(@Param("since") Instant since);
}
