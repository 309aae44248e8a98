package io.github.shiftlog.workforce.application.service;

import io.github.shiftlog.workforce.application.repository.ShiftRepository;
import io.github.shiftlog.workforce.config.WorkforceProperties;
import io.github.shiftlog.workforce.domain.model.ShiftStatus;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.BreakInterval;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Shift;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Violation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Detects missed shifts, late starts and long breaks and records them as automatic violations.
 * Each (shift, rule) pair is recorded at most once, so sweeps can overlap freely.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShiftMonitorService {

    public static final String MISSED_SHIFT = "missed_shift";
    public static final String LATE_START = "late_start";
    public static final String LONG_BREAK = "long_break";

    private final ShiftRepository shiftRepository;
    private final IntervalTrackerService intervalTracker;
    private final ViolationService violationService;
    private final WorkforceProperties properties;
    private final Clock clock;

    /** @return number of violations recorded by this sweep */
    public int sweep() {
        WorkforceProperties.Monitor cfg = properties.getMonitor();
        Instant now = clock.instant();
        Instant since = now.minus(cfg.getLookback());
        int recorded = 0;

        for (Shift shift : shiftRepository.listScheduledStartingBefore(now.minus(cfg.getMissedThreshold()))) {
            if (shift.getPlannedStartAt().isBefore(since)) {
                continue;
            }
            recorded += guarded(shift, MISSED_SHIFT, () -> checkMissed(shift, cfg.getMissedThreshold()));
        }
        for (Shift shift : shiftRepository.listStartedSince(since)) {
            if (shift.getStatus() == ShiftStatus.CANCELLED) {
                continue;
            }
            recorded += guarded(shift, LATE_START, () -> checkLate(shift, cfg.getLateThreshold()));
            recorded += guarded(shift, LONG_BREAK, () -> checkLongBreak(shift, cfg.getLongBreakThreshold(), now));
        }
        if (recorded > 0) {
            log.info("Shift monitor recorded {} violations", recorded);
        }
        return recorded;
    }

    private Optional<Violation> checkMissed(Shift shift, Duration threshold) {
        return violationService.recordAutoViolation(shift, MISSED_SHIFT,
                "Shift not started within " + threshold.toMinutes() + " minutes of planned start");
    }

    private Optional<Violation> checkLate(Shift shift, Duration threshold) {
        Duration late = Duration.between(shift.getPlannedStartAt(), shift.getActualStartAt());
        if (late.compareTo(threshold) <= 0) {
            return Optional.empty();
        }
        return violationService.recordAutoViolation(shift, LATE_START,
                "Started " + late.toMinutes() + " minutes late");
    }

    private Optional<Violation> checkLongBreak(Shift shift, Duration threshold, Instant now) {
        for (BreakInterval b : intervalTracker.breakIntervals(shift.getId())) {
            Duration length = Duration.between(b.getStartAt(), b.getEndAt() != null ? b.getEndAt() : now);
            if (length.compareTo(threshold) > 0) {
                return violationService.recordAutoViolation(shift, LONG_BREAK,
                        "Break of " + length.toMinutes() + " minutes (" + b.getKind() + ")");
            }
        }
        return Optional.empty();
    }

    private int guarded(Shift shift, String check, Supplier<Optional<Violation>> action) {
        try {
            return action.get().isPresent() ? 1 : 0;
        } catch (RuntimeException e) {
            log.warn("Shift monitor check {} failed for shift {}", check, shift.getId(), e);
            return 0;
        }
    }
}
