package forecasting.yaml;

import forecasting.global.ForecastException;
import forecasting.global.Throughput;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThroughputYamlReaderTest {
	private static final Path ORIGIN = Path.of("throughput.yaml");

	private final ThroughputYamlReader reader = new ThroughputYamlReader();

	@Test
	void readsTheDailyHistory() {
		final var throughput = reader.parse("""
				- date: 2026-02-09
				  completed_issues: 5
				- date: 2026-02-10
				  completed_issues: 3
				""", ORIGIN);

		assertThat(throughput).containsExactly(
				new Throughput(LocalDate.of(2026, 2, 9), 5),
				new Throughput(LocalDate.of(2026, 2, 10), 3)
		);
	}

	@Test
	void anEmptyDocumentIsAnEmptyHistory() {
		assertThat(reader.parse("", ORIGIN)).isEmpty();
	}

	@Test
	void rejectsNegativeCounts() {
		assertThatThrownBy(() -> reader.parse("- {date: 2026-02-09, completed_issues: -1}", ORIGIN))
				.isInstanceOf(ForecastException.class)
				.hasMessageContaining("completed_issues");
	}

	@Test
	void rejectsEntriesWithoutDate() {
		assertThatThrownBy(() -> reader.parse("- {completed_issues: 1}", ORIGIN))
				.isInstanceOf(ForecastException.class)
				.hasMessageContaining("missing field 'date'");
	}
}
