package io.github.shiftlog.workforce.application.dto;

import io.github.shiftlog.workforce.infrastructure.persistence.entity.BreakInterval;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Shift;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.WorkInterval;

import java.util.List;

public record ShiftDetail(
        Shift shift,
        List<WorkInterval> workIntervals,
        List<BreakInterval> breakIntervals,
        long netWorkedMinutes
) {
}
