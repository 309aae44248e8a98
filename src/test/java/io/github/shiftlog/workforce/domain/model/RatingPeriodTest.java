package io.github.shiftlog.workforce.domain.model;

import io.github.shiftlog.workforce.domain.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RatingPeriodTest {

    @Test
    void monthOf_isHalfOpenCalendarMonth() {
        RatingPeriod period = RatingPeriod.monthOf(LocalDate.of(2024, 12, 31));

        assertThat(period.start()).isEqualTo(LocalDate.of(2024, 12, 1));
        assertThat(period.end()).isEqualTo(LocalDate.of(2025, 1, 1));
        assertThat(period).hasToString("[2024-12-01, 2025-01-01)");
    }

    @Test
    void current_usesConfiguredZone() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-31T23:30:00Z"), ZoneOffset.UTC);

        assertThat(RatingPeriod.current(clock, ZoneOffset.UTC).start()).isEqualTo(LocalDate.of(2025, 1, 1));
        assertThat(RatingPeriod.current(clock, ZoneId.of("Europe/Berlin")).start()).isEqualTo(LocalDate.of(2025, 2, 1));
    }

    @Test
    void boundsConvertAtStartOfDayInZone() {
        RatingPeriod period = RatingPeriod.of(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 2, 1));

        assertThat(period.startInstant(ZoneId.of("Europe/Berlin"))).isEqualTo(Instant.parse("2024-12-31T23:00:00Z"));
        assertThat(period.endInstant(ZoneOffset.UTC)).isEqualTo(Instant.parse("2025-02-01T00:00:00Z"));
    }

    @Test
    void emptyOrReversedPeriod_isRejected() {
        LocalDate day = LocalDate.of(2025, 1, 1);

        assertThatThrownBy(() -> RatingPeriod.of(day, day)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> RatingPeriod.of(day, day.minusDays(1))).isInstanceOf(ValidationException.class);
    }
}
