package forecasting.projectsimulation;

import forecasting.global.Calendar;
import forecasting.global.ForecastException;
import forecasting.global.TeamCalendar;
import net.jqwik.api.Example;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.DoubleRange;

import java.time.DayOfWeek;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CapacityTimelineTest {
	private static final LocalDate MONDAY = LocalDate.of(2026, 2, 16);

	@Example
	void effortWithinTheWorkingWeekTakesAsManyDays() {
		final var timeline = new CapacityTimeline(TeamCalendar.defaultCalendar(), MONDAY);
		assertEquals(3d, timeline.finishOffset(0, 3), 1e-12);
		assertEquals(4.5, timeline.finishOffset(2, 2.5), 1e-12);
	}

	@Example
	void theWeekendStretchesTheElapsedTime() {
		final var timeline = new CapacityTimeline(TeamCalendar.defaultCalendar(), MONDAY);
		assertEquals(8d, timeline.finishOffset(5, 1), 1e-12);
		assertEquals(7.5, timeline.finishOffset(4, 1.5), 1e-12);
	}

	@Example
	void halfCapacityDoublesTheElapsedTime() {
		final var team = TeamCalendar.of(Calendar.alwaysAvailable(), Calendar.freeOn(DayOfWeek.values()));
		final var timeline = new CapacityTimeline(team, MONDAY);
		assertEquals(3d, timeline.finishOffset(0, 1.5), 1e-12);
	}

	@Example
	void noEffortFinishesWhenReady() {
		final var timeline = new CapacityTimeline(TeamCalendar.defaultCalendar(), MONDAY);
		assertEquals(5.25, timeline.finishOffset(5.25, 0));
	}

	@Example
	void aCalendarWithoutCapacityIsRejected() {
		final var timeline = new CapacityTimeline(TeamCalendar.of(Calendar.freeOn(DayOfWeek.values())), MONDAY);
		assertThatThrownBy(() -> timeline.finishOffset(0, 1))
				.isInstanceOf(ForecastException.class)
				.extracting(e -> ((ForecastException) e).getKind())
				.isEqualTo(ForecastException.Kind.CONFIGURATION);
	}

	@Example
	void workReadyBeyondACenturyStillFindsCapacity() {
		final var timeline = new CapacityTimeline(TeamCalendar.defaultCalendar(), MONDAY);
		final var ready = 40_000d;
		final var finish = timeline.finishOffset(ready, 1);
		assertTrue(finish >= ready + 1 && finish <= ready + 4, "finish " + finish);
	}

	@Example
	void theMissingCapacityIsReportedFromTheReadyDay() {
		final var timeline = new CapacityTimeline(TeamCalendar.of(Calendar.freeOn(DayOfWeek.values())), MONDAY);
		assertThatThrownBy(() -> timeline.finishOffset(10.5, 1))
				.isInstanceOf(ForecastException.class)
				.hasMessageEndingWith("2026-02-26");
	}

	@Property
	boolean theFinishNeverPrecedesTheReadyTimePlusTheEffort(
			@ForAll @DoubleRange(min = 0, max = 400) double ready,
			@ForAll @DoubleRange(min = 0, max = 50) double effort
	) {
		final var timeline = new CapacityTimeline(TeamCalendar.defaultCalendar(), MONDAY);
		return timeline.finishOffset(ready, effort) >= ready + effort - 1e-9;
	}
}
