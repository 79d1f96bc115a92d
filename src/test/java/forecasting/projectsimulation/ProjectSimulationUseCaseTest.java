package forecasting.projectsimulation;

import forecasting.global.ForecastException;
import forecasting.global.Project;
import forecasting.global.RunClock;
import forecasting.global.TeamCalendar;
import org.junit.jupiter.api.Test;

import fj.data.List;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.OptionalLong;

import static forecasting.projectsimulation.CriticalPathSimulatorTest.days;
import static forecasting.projectsimulation.CriticalPathSimulatorTest.points;
import static forecasting.projectsimulation.VelocityCalculatorTest.doneItem;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProjectSimulationUseCaseTest {
	private static final LocalDate TODAY = LocalDate.of(2026, 3, 2);
	private static final RunClock RUN_CLOCK = new RunClock(Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC));

	private static ProjectSimulationUseCase useCaseFor(final Project project) {
		return new ProjectSimulationUseCase(
				RUN_CLOCK,
				file -> project,
				directory -> TeamCalendar.defaultCalendar(),
				(seed, worker) -> seed.isPresent() ? BetaPertSampler.forStream(seed, worker) : ThreePointSampler.mostLikely()
		);
	}

	private static ProjectSimulationUseCase.Request request(final int iterations, final Optional<LocalDate> startDate, final int workers) {
		return new ProjectSimulationUseCase.Request(
				Path.of("plans", "release.yaml"),
				iterations,
				startDate,
				Optional.empty(),
				OptionalLong.empty(),
				workers
		);
	}

	@Test
	void labelsTheReportWithTheProjectFileName() {
		final var output = useCaseFor(new Project("Release", List.list(days("A", 2), days("B", 3, "A"))))
				.execute(request(10, Optional.of(LocalDate.of(2026, 2, 16)), 1));

		assertThat(output.report().dataSource()).isEqualTo("release.yaml");
		assertThat(output.report().p50().days()).isEqualTo(5d);
		assertThat(output.report().startDate()).isEqualTo(LocalDate.of(2026, 2, 16));
		assertThat(output.report().velocity()).isEmpty();
		assertThat(output.report().simulatedItems()).isEqualTo(2);
	}

	@Test
	void startsTodayWhenNoStartDateIsGiven() {
		final var output = useCaseFor(new Project("Release", List.single(days("A", 1))))
				.execute(request(1, Optional.empty(), 1));

		assertThat(output.report().startDate()).isEqualTo(TODAY);
		assertThat(output.report().p0().date()).isEqualTo(TODAY.plusDays(1));
	}

	@Test
	void measuresTheVelocityWhenStoryPointsAreInvolved() {
		final var monday = LocalDate.of(2026, 2, 16);
		final var project = new Project("Release", List.list(
				doneItem("DONE-1", 4, monday.minusDays(7), monday.minusDays(6)),
				points("SP-1", 2)
		));
		final var output = useCaseFor(project).execute(request(5, Optional.of(monday), 1));

		assertThat(output.report().velocity()).hasValue(2d);
		assertThat(output.report().p100().days()).isEqualTo(2d);
	}

	@Test
	void seededRunsWithTheSameWorkersAreReproducible() {
		final var project = new Project("Release", List.list(days("A", 1), days("B", 1, "A")));
		final var useCase = new ProjectSimulationUseCase(
				RUN_CLOCK,
				file -> project,
				directory -> TeamCalendar.defaultCalendar(),
				BetaPertSampler::forStream
		);
		final var request = new ProjectSimulationUseCase.Request(
				Path.of("release.yaml"), 1000, Optional.of(TODAY), Optional.empty(), OptionalLong.of(11), 3);

		final var first = useCase.execute(request);
		final var second = useCase.execute(request);

		assertThat(first.results()).hasSize(1000).containsExactly(second.results());
	}

	@Test
	void rejectsAnEmptyProject() {
		assertThatThrownBy(() -> useCaseFor(new Project("Empty", List.nil())).execute(request(10, Optional.empty(), 1)))
				.isInstanceOf(ForecastException.class)
				.hasMessage("project has no work packages");
	}

	@Test
	void rejectsANonPositiveNumberOfWorkers() {
		assertThatThrownBy(() -> useCaseFor(new Project("Release", List.single(days("A", 1)))).execute(request(10, Optional.empty(), 0)))
				.isInstanceOf(ForecastException.class)
				.hasMessage("workers must be greater than zero");
	}

	@Test
	void rejectsCyclicProjects() {
		final var project = new Project("Cyclic", List.list(days("A", 1, "B"), days("B", 1, "A")));
		assertThatThrownBy(() -> useCaseFor(project).execute(request(10, Optional.empty(), 1)))
				.isInstanceOf(ForecastException.class)
				.hasMessage("dependency graph has a cycle");
	}
}
