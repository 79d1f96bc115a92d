package forecasting.projectsimulation;

import forecasting.global.ForecastException;
import forecasting.global.TeamCalendar;

import java.time.LocalDate;
import java.util.Arrays;

/**
 * Converts effort, measured in capacity-days, into elapsed days by consuming the daily capacity of a {@link TeamCalendar}.
 * Offsets are measured in days from the origin date; offset {@code t} lies in the day {@code floor(t)}.
 * <p>The capacity of each day is computed once and memoized. Not thread safe.
 */
final class CapacityTimeline {
	/** A century, counted from the day the work is ready. A calendar that offers nothing within it never will. */
	static final int HORIZON_DAYS = 36_525;

	private static final double TOLERANCE = 1e-9;

	private final TeamCalendar calendar;
	private final LocalDate origin;
	private double[] capacities = new double[64];
	private int knownDays = 0;

	CapacityTimeline(final TeamCalendar calendar, final LocalDate origin) {
		this.calendar = calendar;
		this.origin = origin;
	}

	double capacityAt(final int dayOffset) {
		while (knownDays <= dayOffset) {
			if (knownDays == capacities.length) {
				capacities = Arrays.copyOf(capacities, capacities.length * 2);
			}
			capacities[knownDays] = Math.max(0d, calendar.capacity(origin.plusDays(knownDays)));
			knownDays += 1;
		}
		return capacities[dayOffset];
	}

	/**
	 * Consumes the specified effort starting at the {@code ready} offset. A day of capacity {@code c} can absorb at most {@code c} units
	 * of effort, proportionally less when the work starts partway through it.
	 * @return the offset at which the effort is exhausted; {@code ready} itself when there is no effort.
	 * @throws ForecastException if the calendar offers no capacity within {@value #HORIZON_DAYS} days of the ready offset.
	 */
	double finishOffset(final double ready, final double effort) {
		if (!(effort > 0)) {
			return ready;
		}
		final var readyDay = (int) Math.floor(ready);
		var time = ready;
		var remaining = effort;
		while (true) {
			final var day = (int) Math.floor(time);
			if (day - readyDay >= HORIZON_DAYS) {
				throw ForecastException.calendarWithoutCapacity(origin.plusDays(readyDay));
			}
			final var capacity = capacityAt(day);
			if (capacity > 0) {
				final var dayLeft = day + 1 - time;
				final var available = dayLeft * capacity;
				if (available >= remaining - TOLERANCE) {
					return time + Math.min(dayLeft, remaining / capacity);
				}
				remaining -= available;
			}
			time = day + 1;
		}
	}
}
