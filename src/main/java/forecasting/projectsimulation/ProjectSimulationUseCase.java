package forecasting.projectsimulation;

import forecasting.global.ForecastException;
import forecasting.global.Project;
import forecasting.global.RunClock;
import forecasting.global.SimulationOutput;
import forecasting.global.TeamCalendar;
import lombok.RequiredArgsConstructor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Forecasts when a project will be finished: loads it, orders its work items, measures the velocity when story points are involved and
 * runs the critical path simulation.
 */
@Service
@RequiredArgsConstructor
public class ProjectSimulationUseCase {
	private static final Logger logger = LogManager.getLogger(ProjectSimulationUseCase.class);

	private final RunClock runClock;
	private final Function<Path, Project> projectSupplier;
	private final Function<Optional<Path>, TeamCalendar> teamCalendarSupplier;
	private final BiFunction<OptionalLong, Integer, ThreePointSampler> samplerSupplier;

	/**
	 * @param startDate the day the work starts; today when absent.
	 * @param calendarDirectory a directory with one calendar file per team member; the default weekday calendar when absent.
	 * @param seed makes the run reproducible when present.
	 * @param workers how many threads share the trials.
	 */
	public record Request(
			Path projectFile,
			int iterations,
			Optional<LocalDate> startDate,
			Optional<Path> calendarDirectory,
			OptionalLong seed,
			int workers
	) {}

	public SimulationOutput execute(final Request request) {
		if (request.iterations() <= 0) {
			throw ForecastException.invalidIterations();
		}
		if (request.workers() <= 0) {
			throw ForecastException.invalidWorkers();
		}
		final var project = projectSupplier.apply(request.projectFile());
		if (project.workPackages().isEmpty()) {
			throw ForecastException.emptyProject();
		}
		final var calendar = teamCalendarSupplier.apply(request.calendarDirectory());
		final var startDate = request.startDate().orElseGet(runClock::today);

		final var order = DependencyGraph.topologicalOrder(project);
		final var velocity = project.hasStoryPoints()
				? OptionalDouble.of(VelocityCalculator.calculate(project, calendar))
				: OptionalDouble.empty();
		velocity.ifPresent(value -> logger.info("velocity of project {}: {} story points per capacity-day", project.name(), value));

		final var plan = CriticalPathSimulator.prepare(project, order, velocity, startDate, calendar);
		logger.info(
				"simulating {} work items of project {} from {} with {} iterations",
				order.length(), project.name(), startDate, request.iterations()
		);
		final var samples = CriticalPathSimulator.runTrials(
				plan,
				request.iterations(),
				request.workers(),
				worker -> samplerSupplier.apply(request.seed(), worker)
		);
		return CriticalPathSimulator.aggregate(dataSourceOf(request.projectFile()), plan, samples);
	}

	static String dataSourceOf(final Path file) {
		final var fileName = file.getFileName();
		return fileName == null ? file.toString() : fileName.toString();
	}
}
