package forecasting.global;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * The availability of one person or sub-team: the whole capacity except on free weekdays and inside free date ranges.
 */
public record Calendar(Set<DayOfWeek> freeWeekdays, List<FreeDateRange> freeDateRanges) {

	public Calendar {
		freeWeekdays = Set.copyOf(freeWeekdays);
		freeDateRanges = List.copyOf(freeDateRanges);
	}

	public static Calendar alwaysAvailable() {
		return new Calendar(Set.of(), List.of());
	}

	public static Calendar freeOn(final DayOfWeek... freeWeekdays) {
		return new Calendar(Set.of(freeWeekdays), List.of());
	}

	/**
	 * @return 0 when the date is a free weekday or falls in a free range, 1 otherwise.
	 */
	public double capacity(final LocalDate date) {
		if (freeWeekdays.contains(date.getDayOfWeek())) {
			return 0d;
		}
		for (var range : freeDateRanges) {
			if (range.contains(date)) {
				return 0d;
			}
		}
		return 1d;
	}

	/**
	 * An inclusive range of days off.
	 */
	public record FreeDateRange(LocalDate startDate, LocalDate endDate) {

		public FreeDateRange {
			if (startDate.isAfter(endDate)) {
				throw ForecastException.invalidDateRange(startDate, endDate);
			}
		}

		public boolean contains(final LocalDate date) {
			return !date.isBefore(startDate) && !date.isAfter(endDate);
		}
	}
}
