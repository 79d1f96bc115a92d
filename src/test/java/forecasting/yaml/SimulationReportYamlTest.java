package forecasting.yaml;

import forecasting.global.ForecastException;
import forecasting.global.Percentiles;
import forecasting.global.SimulationReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SimulationReportYamlTest {
	private static final Path ORIGIN = Path.of("report.yaml");

	private final SimulationReportYaml reportYaml = new SimulationReportYaml();

	private static SimulationReport report() {
		return SimulationReport.of(
				"project.yaml",
				LocalDate.of(2026, 2, 16),
				OptionalDouble.of(2.5),
				100,
				12,
				new Percentiles(1, 5.5, 10, 15.25)
		);
	}

	@Test
	void writesTheFieldsInBlockStyle() {
		final var yaml = reportYaml.dump(report());

		assertThat(yaml).startsWith("data_source: project.yaml\n");
		assertThat(yaml).contains("start_date: 2026-02-16", "velocity: 2.5", "iterations: 100", "simulated_items: 12");
		assertThat(yaml).contains("p50:\n  days: 5.5\n  date: 2026-02-22");
	}

	@Test
	void readsWhatItWrites(@TempDir Path directory) {
		final var file = directory.resolve("report.yaml");
		reportYaml.write(file, report());

		assertThat(reportYaml.read(file)).isEqualTo(report());
	}

	@Test
	void anAbsentVelocityIsWrittenAsNull() {
		final var report = SimulationReport.of(
				"t.yaml", LocalDate.of(2026, 2, 16), OptionalDouble.empty(), 1, 1, Percentiles.ZERO);

		assertThat(reportYaml.dump(report)).contains("velocity: null");
		assertThat(reportYaml.parse(reportYaml.dump(report), ORIGIN).velocity()).isEmpty();
	}

	@Test
	void rejectsInvalidDates() {
		assertThatThrownBy(() -> reportYaml.parse("""
				data_source: x.yaml
				start_date: 2026-02-01
				iterations: 1
				simulated_items: 1
				p0: {days: 1.0, date: 2026-02-02}
				p50: {days: 1.0, date: 2026-02-31}
				p85: {days: 1.0, date: 2026-02-02}
				p100: {days: 1.0, date: 2026-02-02}
				""", ORIGIN))
				.isInstanceOf(ForecastException.class)
				.hasMessageContaining("2026-02-31");
	}

	@Test
	void rejectsReportsWithMissingFields() {
		assertThatThrownBy(() -> reportYaml.parse("data_source: x.yaml\nstart_date: 2026-02-01\n", ORIGIN))
				.isInstanceOf(ForecastException.class)
				.hasMessageContaining("iterations");
	}
}
