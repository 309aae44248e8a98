package io.github.shiftlog.workforce.domain.model;

import io.github.shiftlog.workforce.domain.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Half-open date range {@code [start, end)} a rating is computed over. Usually a calendar month.
 */
public record RatingPeriod(LocalDate start, LocalDate end) {

    public RatingPeriod {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!end.isAfter(start)) {
            throw new ValidationException("period end must be after start: " + start + ".." + end);
        }
    }

    public static RatingPeriod of(LocalDate start, LocalDate end) {
        return new RatingPeriod(start, end);
    }

    public static RatingPeriod monthOf(LocalDate date) {
        YearMonth ym = YearMonth.from(date);
        return new RatingPeriod(ym.atDay(1), ym.plusMonths(1).atDay(1));
    }

    public static RatingPeriod current(Clock clock, ZoneId zone) {
        return monthOf(LocalDate.ofInstant(clock.instant(), zone));
    }

    public Instant startInstant(ZoneId zone) {
        return start.atStartOfDay(zone).toInstant();
    }

    public Instant endInstant(ZoneId zone) {
        return end.atStartOfDay(zone).toInstant();
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
