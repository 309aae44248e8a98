package io.github.shiftlog.workforce.application.service;

import io.github.shiftlog.workforce.application.cache.CompanyChangeNotifier;
import io.github.shiftlog.workforce.application.dto.ShiftDetail;
import io.github.shiftlog.workforce.application.repository.EmployeeRepository;
import io.github.shiftlog.workforce.application.repository.ShiftRepository;
import io.github.shiftlog.workforce.domain.exception.InvalidStateTransitionException;
import io.github.shiftlog.workforce.domain.exception.NotFoundException;
import io.github.shiftlog.workforce.domain.exception.ValidationException;
import io.github.shiftlog.workforce.domain.model.BreakKind;
import io.github.shiftlog.workforce.domain.model.ShiftStatus;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Employee;
import io.github.shiftlog.workforce.infrastructure.persistence.entity.Shift;
import io.github.shiftlog.workforce.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ShiftLifecycleServiceTest {

    private static final Long COMPANY = 10L;

    private EngineFixture fx;
    private Employee employee;

    @BeforeEach
    void setUp() {
        fx = new EngineFixture("2025-03-03T09:00:00Z");
        employee = fx.employees.add(COMPANY, "Ann Worker");
    }

    @Test
    void fullDay_netWorkedExcludesPause() {
        Shift shift = newShift();

        fx.shiftService.start(shift.getId());
        fx.clock.advance(Duration.ofMinutes(60));
        fx.shiftService.pause(shift.getId(), BreakKind.LUNCH);
        fx.clock.advance(Duration.ofMinutes(30));
        fx.shiftService.resume(shift.getId());
        fx.clock.advance(Duration.ofMinutes(90));
        Shift ended = fx.shiftService.end(shift.getId());

        assertThat(ended.getStatus()).isEqualTo(ShiftStatus.COMPLETED);
        ShiftDetail detail = fx.shiftService.getShiftDetail(shift.getId());
        assertThat(detail.shift().getStatus()).isEqualTo(ShiftStatus.COMPLETED);
        assertThat(detail.shift().getActualStartAt()).isBefore(detail.shift().getActualEndAt());
        assertThat(detail.workIntervals()).hasSize(2);
        assertThat(detail.breakIntervals()).singleElement()
                .satisfies(b -> assertThat(b.getKind()).isEqualTo(BreakKind.LUNCH));
        assertThat(detail.netWorkedMinutes()).isEqualTo(150);
        assertThat(fx.intervals.openCount(shift.getId())).isZero();
    }

    @Test
    void startThenEnd_completesWithNoOpenIntervals() {
        Shift shift = newShift();

        fx.shiftService.start(shift.getId());
        fx.clock.advance(Duration.ofMinutes(1));
        fx.shiftService.end(shift.getId());

        Shift stored = fx.shiftService.getShift(shift.getId());
        assertThat(stored.getStatus()).isEqualTo(ShiftStatus.COMPLETED);
        assertThat(stored.getActualStartAt()).isBefore(stored.getActualEndAt());
        assertThat(fx.intervals.openCount(shift.getId())).isZero();
    }

    @Test
    void pause_onScheduledShift_failsAndLeavesStateUnchanged() {
        Shift shift = newShift();

        assertThatThrownBy(() -> fx.shiftService.pause(shift.getId(), BreakKind.BREAK))
                .isInstanceOfSatisfying(InvalidStateTransitionException.class, e -> {
                    assertThat(e.getTransition()).isEqualTo("pause");
                    assertThat(e.getCurrentStatus()).isEqualTo(ShiftStatus.SCHEDULED);
                });

        assertThat(fx.shiftService.getShift(shift.getId()).getStatus()).isEqualTo(ShiftStatus.SCHEDULED);
        assertThat(fx.intervals.breaks().listByShift(shift.getId())).isEmpty();
    }

    @Test
    void start_twice_reportsCurrentState() {
        Shift shift = newShift();
        fx.shiftService.start(shift.getId());

        assertThatThrownBy(() -> fx.shiftService.start(shift.getId()))
                .isInstanceOfSatisfying(InvalidStateTransitionException.class,
                        e -> assertThat(e.getCurrentStatus()).isEqualTo(ShiftStatus.ACTIVE));
        assertThat(fx.intervals.work().listByShift(shift.getId())).hasSize(1);
    }

    @Test
    void resume_onActiveShift_fails() {
        Shift shift = newShift();
        fx.shiftService.start(shift.getId());

        assertThatThrownBy(() -> fx.shiftService.resume(shift.getId()))
                .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    void end_onCompletedShift_fails() {
        Shift shift = newShift();
        fx.shiftService.start(shift.getId());
        fx.shiftService.end(shift.getId());

        assertThatThrownBy(() -> fx.shiftService.end(shift.getId()))
                .isInstanceOfSatisfying(InvalidStateTransitionException.class,
                        e -> assertThat(e.getCurrentStatus()).isEqualTo(ShiftStatus.COMPLETED));
    }

    @Test
    void endFromPaused_closesBreak() {
        Shift shift = newShift();
        fx.shiftService.start(shift.getId());
        fx.clock.advance(Duration.ofMinutes(45));
        fx.shiftService.pause(shift.getId(), null);
        fx.clock.advance(Duration.ofMinutes(15));

        fx.shiftService.end(shift.getId());

        assertThat(fx.intervals.openCount(shift.getId())).isZero();
        assertThat(fx.intervalTracker.netWorkedMinutes(shift.getId())).isEqualTo(45);
    }

    @Test
    void cancel_activeShift_closesIntervalsWithoutActualEnd() {
        Shift shift = newShift();
        fx.shiftService.start(shift.getId());
        fx.clock.advance(Duration.ofMinutes(20));

        Shift cancelled = fx.shiftService.cancel(shift.getId());

        assertThat(cancelled.getStatus()).isEqualTo(ShiftStatus.CANCELLED);
        assertThat(fx.shiftService.getShift(shift.getId()).getActualEndAt()).isNull();
        assertThat(fx.intervals.openCount(shift.getId())).isZero();
        assertThatThrownBy(() -> fx.shiftService.start(shift.getId()))
                .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    void transitions_invalidateCompanyStats() {
        Shift shift = newShift();
        fx.invalidator.invalidated().clear();

        fx.shiftService.start(shift.getId());

        assertThat(fx.invalidator.invalidated()).containsExactly(COMPANY);
    }

    @Test
    void listActiveByCompany_returnsRunningShiftsOnly() {
        Shift running = newShift();
        Shift paused = newShift();
        newShift();
        fx.shiftService.start(running.getId());
        fx.shiftService.start(paused.getId());
        fx.shiftService.pause(paused.getId(), BreakKind.OTHER);

        assertThat(fx.shiftService.listActiveByCompany(COMPANY))
                .extracting(Shift::getId)
                .containsExactlyInAnyOrder(running.getId(), paused.getId());
        assertThat(fx.shiftService.listActiveByCompany(99L)).isEmpty();
    }

    @Test
    void createShift_validatesInput() {
        Instant start = fx.clock.instant();

        assertThatThrownBy(() -> fx.shiftService.createShift(employee.getId(), start, start))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> fx.shiftService.createShift(404L, start, start.plusSeconds(3600)))
                .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> fx.shiftService.getShift(404L))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void lostCompareAndSet_reportsStatusThatWon() {
        ShiftRepository shifts = mock(ShiftRepository.class);
        EmployeeRepository employees = mock(EmployeeRepository.class);
        IntervalTrackerService tracker = mock(IntervalTrackerService.class);
        CompanyChangeNotifier notifier = mock(CompanyChangeNotifier.class);
        ShiftLifecycleService service = new ShiftLifecycleService(shifts, employees, tracker, notifier,
                Clock.fixed(Instant.parse("2025-03-03T09:00:00Z"), ZoneOffset.UTC));

        Shift before = shiftIn(ShiftStatus.SCHEDULED);
        Shift after = shiftIn(ShiftStatus.CANCELLED);
        when(shifts.findById(1L)).thenReturn(before, after);
        when(shifts.updateStatus(eq(1L), eq(ShiftStatus.SCHEDULED), eq(ShiftStatus.ACTIVE), any(), any()))
                .thenReturn(0);

        assertThatThrownBy(() -> service.start(1L))
                .isInstanceOfSatisfying(InvalidStateTransitionException.class,
                        e -> assertThat(e.getCurrentStatus()).isEqualTo(ShiftStatus.CANCELLED));
        verifyNoInteractions(tracker, notifier);
    }

    private Shift newShift() {
        Instant start = fx.clock.instant();
        return fx.shiftService.createShift(employee.getId(), start, start.plus(Duration.ofHours(8)));
    }

    private static Shift shiftIn(ShiftStatus status) {
        Shift s = new Shift();
        s.setId(1L);
        s.setEmployeeId(2L);
        s.setStatus(status);
        return s;
    }
}
