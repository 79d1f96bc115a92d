package forecasting.global;

import java.util.Locale;

public enum Status {
	ToDo,
	InProgress,
	Done;

	/**
	 * Accepts the spellings found in exported trackers: {@code todo}, {@code to do}, {@code inprogress}, {@code in progress} and
	 * {@code done}, ignoring case.
	 */
	public static Status parse(final String text) {
		switch (text.trim().toLowerCase(Locale.ROOT)) {
			case "todo":
			case "to do":
				return ToDo;
			case "inprogress":
			case "in progress":
				return InProgress;
			case "done":
				return Done;
			default:
				throw ForecastException.invalidStatus(text);
		}
	}
}
