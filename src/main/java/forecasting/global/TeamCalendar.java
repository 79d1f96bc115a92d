package forecasting.global;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

/**
 * The fractional capacity of a whole team, composed from the {@link Calendar} of each member.
 * <p>With no member calendars the default policy applies: full capacity on weekdays and none on Saturday and Sunday.
 */
public record TeamCalendar(List<Calendar> calendars) {

	public TeamCalendar {
		calendars = List.copyOf(calendars);
	}

	public static TeamCalendar defaultCalendar() {
		return new TeamCalendar(List.of());
	}

	public static TeamCalendar of(final Calendar... calendars) {
		return new TeamCalendar(List.of(calendars));
	}

	/**
	 * @return the arithmetic mean of the members' capacity on the specified date, a value in [0, 1].
	 */
	public double capacity(final LocalDate date) {
		if (calendars.isEmpty()) {
			return defaultCapacity(date);
		} else {
			var sum = 0d;
			for (var calendar : calendars) {
				sum += calendar.capacity(date);
			}
			return sum / calendars.size();
		}
	}

	/**
	 * Sums the capacity of every day in the inclusive interval [from, to]. Zero when {@code to} precedes {@code from}.
	 */
	public double summedCapacity(final LocalDate from, final LocalDate to) {
		var total = 0d;
		for (var date = from; !date.isAfter(to); date = date.plusDays(1)) {
			total += capacity(date);
		}
		return total;
	}

	public static double defaultCapacity(final LocalDate date) {
		return isWeekend(date) ? 0d : 1d;
	}

	public static boolean isWeekend(final LocalDate date) {
		return date.getDayOfWeek() == DayOfWeek.SATURDAY || date.getDayOfWeek() == DayOfWeek.SUNDAY;
	}
}
