package forecasting.yaml;

import forecasting.global.Calendar;
import forecasting.global.Calendar.FreeDateRange;
import forecasting.global.ForecastException;
import forecasting.global.TeamCalendar;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static forecasting.yaml.YamlDocuments.*;

/**
 * Composes a {@link TeamCalendar} from a directory where every {@code *.yaml} or {@code *.yml} file is the calendar of one member:
 * <pre>
 * free_weekdays: [Sat, Sun]
 * free_date_ranges:
 *   - start_date: 2026-02-23
 *     end_date: 2026-02-27
 * </pre>
 * Without a directory the default weekday calendar applies.
 */
@Component
public class TeamCalendarYamlLoader implements Function<Optional<Path>, TeamCalendar> {
	private static final Logger logger = LogManager.getLogger(TeamCalendarYamlLoader.class);

	@Override
	public TeamCalendar apply(final Optional<Path> directory) {
		return directory.map(this::load).orElseGet(TeamCalendar::defaultCalendar);
	}

	public TeamCalendar load(final Path directory) {
		if (!Files.isDirectory(directory)) {
			throw ForecastException.calendarDirectoryNotFound(directory);
		}
		final java.util.List<Path> files;
		try (Stream<Path> entries = Files.list(directory)) {
			files = entries
					.filter(Files::isRegularFile)
					.filter(TeamCalendarYamlLoader::isYamlFile)
					.sorted()
					.collect(Collectors.toList());
		} catch (IOException e) {
			throw ForecastException.unreadableFile(directory, e);
		}
		if (files.isEmpty()) {
			throw ForecastException.calendarDirectoryEmpty(directory);
		}
		final var calendars = new ArrayList<Calendar>(files.size());
		for (var file : files) {
			calendars.add(toCalendar(YamlDocuments.load(file), file));
		}
		logger.info("team calendar composed of {} member calendars from {}", calendars.size(), directory);
		return new TeamCalendar(calendars);
	}

	public Calendar parse(final String text, final Path origin) {
		return toCalendar(YamlDocuments.parse(text, origin), origin);
	}

	private static Calendar toCalendar(final Object document, final Path origin) {
		if (document == null) {
			return Calendar.alwaysAvailable();
		}
		final var root = asMap(document, origin, "calendar");
		final var freeWeekdays = EnumSet.noneOf(DayOfWeek.class);
		for (var value : asList(root.get("free_weekdays"), origin, "free_weekdays")) {
			freeWeekdays.add(parseWeekday(String.valueOf(value), origin));
		}
		final var freeDateRanges = new ArrayList<FreeDateRange>();
		for (var node : asList(root.get("free_date_ranges"), origin, "free_date_ranges")) {
			final Map<String, Object> range = asMap(node, origin, "free date range");
			freeDateRanges.add(new FreeDateRange(
					requiredDate(range, "start_date", origin),
					requiredDate(range, "end_date", origin)
			));
		}
		return new Calendar(freeWeekdays, freeDateRanges);
	}

	static DayOfWeek parseWeekday(final String value, final Path origin) {
		switch (value.trim().toLowerCase(Locale.ROOT)) {
			case "mon":
			case "monday":
				return DayOfWeek.MONDAY;
			case "tue":
			case "tues":
			case "tuesday":
				return DayOfWeek.TUESDAY;
			case "wed":
			case "wednesday":
				return DayOfWeek.WEDNESDAY;
			case "thu":
			case "thur":
			case "thurs":
			case "thursday":
				return DayOfWeek.THURSDAY;
			case "fri":
			case "friday":
				return DayOfWeek.FRIDAY;
			case "sat":
			case "saturday":
				return DayOfWeek.SATURDAY;
			case "sun":
			case "sunday":
				return DayOfWeek.SUNDAY;
			default:
				throw ForecastException.invalidWeekday(origin, value);
		}
	}

	private static boolean isYamlFile(final Path file) {
		final var name = file.getFileName().toString();
		return name.endsWith(".yaml") || name.endsWith(".yml");
	}
}
