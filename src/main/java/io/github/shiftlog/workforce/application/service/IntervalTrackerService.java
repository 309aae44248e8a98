package io.github.shiftlog.workforce.application.service;

import io.github.shiftlog.workforce.application.repository.BreakIntervalRepository;
import io.github.shiftlog.workforce.application.repository.WorkIntervalRepository;
import io.github.shiftlog.workforce.domain.exception.ConflictException;
import io.github.shiftlog.workforce.domain.exception.ValidationException;
import io.github.shiftlog.workforce.domain.model.BreakKind;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.BreakInterval;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.WorkInterval;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Work/break interval bookkeeping for a shift.
 * <p>
 * A shift never has more than one open interval in total: opening a work or break interval
 * fails while either kind is still open. The tracker knows nothing about shift status; ordering
 * of close/open calls is the lifecycle manager's job.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IntervalTrackerService {

    private final WorkIntervalRepository workIntervalRepository;
    private final BreakIntervalRepository breakIntervalRepository;

    public WorkInterval openWorkInterval(Long shiftId, Instant at) {
        requireArgs(shiftId, at);
        WorkInterval interval = new WorkInterval();
        interval.setShiftId(shiftId);
        interval.setStartAt(at);
        int inserted;
        try {
            inserted = workIntervalRepository.insertIfNoneOpen(interval);
        } catch (DuplicateKeyException e) {
            // concurrent opener hit the partial unique index first
            inserted = 0;
        }
        if (inserted == 0) {
            throw new ConflictException("shift " + shiftId + " already has an open interval");
        }
        log.debug("Work interval opened: shiftId={}, intervalId={}, at={}", shiftId, interval.getId(), at);
        return interval;
    }

    /**
     * Closes the open work interval if there is one. Closing when nothing is open is a no-op so
     * that retried requests stay harmless.
     *
     * @return whether an interval was closed
     */
    public boolean closeOpenWorkInterval(Long shiftId, Instant at) {
        requireArgs(shiftId, at);
        WorkInterval open = workIntervalRepository.findOpen(shiftId);
        if (open == null) {
            return false;
        }
        if (at.isBefore(open.getStartAt())) {
            throw new ValidationException("interval cannot end before it starts: " + at + " < " + open.getStartAt());
        }
        boolean closed = workIntervalRepository.closeOpen(shiftId, at) > 0;
        log.debug("Work interval closed: shiftId={}, at={}, closed={}", shiftId, at, closed);
        return closed;
    }

    public BreakInterval openBreakInterval(Long shiftId, Instant at, BreakKind kind) {
        requireArgs(shiftId, at);
        BreakInterval interval = new BreakInterval();
        interval.setShiftId(shiftId);
        interval.setStartAt(at);
        interval.setKind(kind == null ? BreakKind.BREAK : kind);
        int inserted;
        try {
            inserted = breakIntervalRepository.insertIfNoneOpen(interval);
        } catch (DuplicateKeyException e) {
            inserted = 0;
        }
        if (inserted == 0) {
            throw new ConflictException("shift " + shiftId + " already has an open interval");
        }
        log.debug("Break interval opened: shiftId={}, kind={}, at={}", shiftId, interval.getKind(), at);
        return interval;
    }

    public boolean closeOpenBreakInterval(Long shiftId, Instant at) {
        requireArgs(shiftId, at);
        BreakInterval open = breakIntervalRepository.findOpen(shiftId);
        if (open == null) {
            return false;
        }
        if (at.isBefore(open.getStartAt())) {
            throw new ValidationException("interval cannot end before it starts: " + at + " < " + open.getStartAt());
        }
        boolean closed = breakIntervalRepository.closeOpen(shiftId, at) > 0;
        log.debug("Break interval closed: shiftId={}, at={}, closed={}", shiftId, at, closed);
        return closed;
    }

    public List<WorkInterval> workIntervals(Long shiftId) {
        return workIntervalRepository.listByShift(shiftId);
    }

    public List<BreakInterval> breakIntervals(Long shiftId) {
        return breakIntervalRepository.listByShift(shiftId);
    }

    /** Net worked minutes over closed intervals only. */
    public long netWorkedMinutes(Long shiftId) {
        return netWorkedMinutes(shiftId, null);
    }

    /**
     * Net worked minutes where open intervals count up to {@code asOf}. A null {@code asOf}
     * excludes open intervals.
     */
    public long netWorkedMinutes(Long shiftId, Instant asOf) {
        return netWorked(workIntervals(shiftId), breakIntervals(shiftId), asOf).toMinutes();
    }

    /**
     * Work time minus the part of break time that overlaps work time, never negative.
     */
    static Duration netWorked(List<WorkInterval> work, List<BreakInterval> breaks, Instant asOf) {
        Duration worked = Duration.ZERO;
        Duration overlap = Duration.ZERO;
        for (WorkInterval w : work) {
            Instant wEnd = effectiveEnd(w.getEndAt(), asOf);
            if (wEnd == null || !wEnd.isAfter(w.getStartAt())) {
                continue;
            }
            worked = worked.plus(Duration.between(w.getStartAt(), wEnd));
            for (BreakInterval b : breaks) {
                Instant bEnd = effectiveEnd(b.getEndAt(), asOf);
                if (bEnd == null) {
                    continue;
                }
                Instant from = later(w.getStartAt(), b.getStartAt());
                Instant to = earlier(wEnd, bEnd);
                if (to.isAfter(from)) {
                    overlap = overlap.plus(Duration.between(from, to));
                }
            }
        }
        Duration net = worked.minus(overlap);
        return net.isNegative() ? Duration.ZERO : net;
    }

    private static Instant effectiveEnd(Instant endAt, Instant asOf) {
        return endAt != null ? endAt : asOf;
    }

    private static Instant later(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }

    private static Instant earlier(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }

    private static void requireArgs(Long shiftId, Instant at) {
        if (shiftId == null || at == null) {
            throw new ValidationException("shiftId and timestamp are required");
        }
    }
}
