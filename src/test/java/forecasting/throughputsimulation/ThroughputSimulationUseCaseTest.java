package forecasting.throughputsimulation;

import forecasting.global.RunClock;
import forecasting.global.TeamCalendar;
import forecasting.global.Throughput;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThroughputSimulationUseCaseTest {
	private static final LocalDate SATURDAY = LocalDate.of(2026, 2, 21);

	private final ThroughputSimulationUseCase useCase = new ThroughputSimulationUseCase(
			new RunClock(Clock.fixed(SATURDAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC)),
			file -> List.of(new Throughput(LocalDate.of(2026, 2, 9), 5), new Throughput(LocalDate.of(2026, 2, 10), 3)),
			directory -> TeamCalendar.defaultCalendar(),
			seed -> RandomSource.XO_SHI_RO_256_PP.create(seed.orElse(0L))
	);

	@Test
	void labelsTheReportWithTheThroughputFileNameAndStartsToday() {
		final var output = useCase.execute(new ThroughputSimulationUseCase.Request(
				Path.of("data", "throughput.yaml"), 200, 12, Optional.empty(), Optional.empty(), OptionalLong.of(5)));

		assertThat(output.report().dataSource()).isEqualTo("throughput.yaml");
		assertThat(output.report().startDate()).isEqualTo(SATURDAY);
		assertThat(output.report().iterations()).isEqualTo(200);
		assertThat(output.report().simulatedItems()).isEqualTo(12);
		// 12 issues at 3 to 5 a day take 3 or 4 working days starting on Monday
		assertThat(output.report().p0().days()).isBetween(3d, 4d);
		assertThat(output.report().p100().days()).isBetween(3d, 4d);
		assertThat(output.report().p0().date()).isAfterOrEqualTo(LocalDate.of(2026, 2, 25));
	}

	@Test
	void rejectsANonPositiveNumberOfIssues() {
		assertThatThrownBy(() -> useCase.execute(new ThroughputSimulationUseCase.Request(
				Path.of("throughput.yaml"), 10, 0, Optional.empty(), Optional.empty(), OptionalLong.empty())))
				.hasMessage("number of issues must be greater than zero");
	}
}
