package forecasting.throughputsimulation;

import forecasting.global.ForecastException;
import forecasting.global.Percentiles;
import forecasting.global.SimulationOutput;
import forecasting.global.SimulationReport;
import forecasting.global.TeamCalendar;
import forecasting.global.Throughput;
import org.apache.commons.rng.UniformRandomProvider;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Optional;

/**
 * Forecasts how many working days a number of issues takes by replaying the historical daily throughput of the team.
 * <p>Each trial walks the working days from the start date on. Every day completes the issues of a uniformly chosen historical day,
 * scaled by the team capacity of that day, until the target is reached. The result of the trial is the number of working days walked.
 */
public final class ThroughputSimulator {
	private ThroughputSimulator() {}

	/** A century of working days. A calendar that offers nothing within it never will. */
	static final int HORIZON_WORKDAYS = 26_100;

	/**
	 * @throws ForecastException if the iterations or the number of issues are not positive, if the throughput history is empty or has no
	 * nonzero day, or if the calendar never offers capacity.
	 */
	public static SimulationOutput simulate(
			final List<Throughput> throughput,
			final int iterations,
			final int numberOfIssues,
			final LocalDate startDate,
			final TeamCalendar calendar,
			final UniformRandomProvider rng
	) {
		if (iterations <= 0) {
			throw ForecastException.invalidIterations();
		}
		if (numberOfIssues <= 0) {
			throw ForecastException.invalidIssueCount();
		}
		if (throughput.isEmpty()) {
			throw ForecastException.emptyThroughput();
		}
		final var history = throughput.stream().mapToInt(Throughput::completedIssues).toArray();
		if (Arrays.stream(history).allMatch(completed -> completed == 0)) {
			throw ForecastException.zeroThroughput();
		}

		final var results = new double[iterations];
		for (var trial = 0; trial < iterations; ++trial) {
			results[trial] = simulateSingleRun(history, numberOfIssues, startDate, calendar, rng);
		}
		Arrays.sort(results);

		final var report = SimulationReport.of(
				"",
				startDate,
				OptionalDouble.empty(),
				iterations,
				numberOfIssues,
				Percentiles.ofSorted(results),
				days -> endDateFromWorkdays(startDate, days)
		);
		return new SimulationOutput(report, results, Optional.empty());
	}

	private static int simulateSingleRun(
			final int[] history,
			final int numberOfIssues,
			final LocalDate startDate,
			final TeamCalendar calendar,
			final UniformRandomProvider rng
	) {
		var completed = 0d;
		var days = 0;
		var date = nextWorkday(startDate);
		while (completed < numberOfIssues) {
			if (days == HORIZON_WORKDAYS) {
				throw ForecastException.calendarWithoutCapacity(startDate);
			}
			days += 1;
			final var sampled = history[rng.nextInt(history.length)];
			completed += sampled * Math.max(0d, calendar.capacity(date));
			if (completed >= numberOfIssues) {
				break;
			}
			date = nextWorkday(date.plusDays(1));
		}
		return days;
	}

	/**
	 * Maps a number of working days to the date of the last of them: zero days end on the first working day on or after the start date;
	 * every further day steps to the next working day.
	 */
	public static LocalDate endDateFromWorkdays(final LocalDate startDate, final double days) {
		final var wholeDays = (long) Math.max(0d, Math.ceil(days));
		var date = nextWorkday(startDate);
		for (var day = 1L; day < wholeDays; ++day) {
			date = nextWorkday(date.plusDays(1));
		}
		return date;
	}

	static LocalDate nextWorkday(final LocalDate date) {
		var workday = date;
		while (TeamCalendar.isWeekend(workday)) {
			workday = workday.plusDays(1);
		}
		return workday;
	}
}
