package forecasting.throughputsimulation;

import forecasting.global.ForecastException;
import forecasting.global.RunClock;
import forecasting.global.SimulationOutput;
import forecasting.global.TeamCalendar;
import forecasting.global.Throughput;
import lombok.RequiredArgsConstructor;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Function;

/**
 * Forecasts when a number of issues will be done from the daily throughput history of the team.
 */
@Service
@RequiredArgsConstructor
public class ThroughputSimulationUseCase {
	private static final Logger logger = LogManager.getLogger(ThroughputSimulationUseCase.class);

	private final RunClock runClock;
	private final Function<Path, List<Throughput>> throughputSupplier;
	private final Function<Optional<Path>, TeamCalendar> teamCalendarSupplier;
	private final Function<OptionalLong, UniformRandomProvider> randomSupplier;

	public record Request(
			Path throughputFile,
			int iterations,
			int numberOfIssues,
			Optional<LocalDate> startDate,
			Optional<Path> calendarDirectory,
			OptionalLong seed
	) {}

	public SimulationOutput execute(final Request request) {
		if (request.iterations() <= 0) {
			throw ForecastException.invalidIterations();
		}
		if (request.numberOfIssues() <= 0) {
			throw ForecastException.invalidIssueCount();
		}
		final var throughput = throughputSupplier.apply(request.throughputFile());
		final var calendar = teamCalendarSupplier.apply(request.calendarDirectory());
		final var startDate = request.startDate().orElseGet(runClock::today);
		logger.info(
				"simulating {} issues over {} days of throughput history from {} with {} iterations",
				request.numberOfIssues(), throughput.size(), startDate, request.iterations()
		);
		final var output = ThroughputSimulator.simulate(
				throughput,
				request.iterations(),
				request.numberOfIssues(),
				startDate,
				calendar,
				randomSupplier.apply(request.seed())
		);
		final var fileName = request.throughputFile().getFileName();
		return output.withDataSource(fileName == null ? request.throughputFile().toString() : fileName.toString());
	}
}
