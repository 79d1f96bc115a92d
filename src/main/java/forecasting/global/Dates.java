package forecasting.global;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * The {@code YYYY-MM-DD} date format shared by every file the tool reads or writes.
 */
public final class Dates {
	private Dates() {}

	public static final DateTimeFormatter FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

	public static LocalDate parse(final String value) {
		try {
			return LocalDate.parse(value.trim(), FORMAT);
		} catch (DateTimeParseException e) {
			throw ForecastException.invalidDate(value);
		}
	}

	public static String format(final LocalDate date) {
		return FORMAT.format(date);
	}
}
