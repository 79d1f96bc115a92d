package forecasting.yaml;

import forecasting.global.ForecastException;
import forecasting.global.TeamCalendar;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TeamCalendarYamlLoaderTest {
	private static final LocalDate MONDAY = LocalDate.of(2026, 2, 16);

	private final TeamCalendarYamlLoader loader = new TeamCalendarYamlLoader();

	@Test
	void everyYamlFileIsOneMember(@TempDir Path directory) throws IOException {
		Files.writeString(directory.resolve("alice.yaml"), """
				free_weekdays: [Sat, Sun]
				""");
		Files.writeString(directory.resolve("bob.yml"), """
				free_weekdays: [saturday, SUNDAY, Mon]
				free_date_ranges:
				  - start_date: 2026-02-18
				    end_date: 2026-02-19
				""");
		Files.writeString(directory.resolve("notes.txt"), "not a calendar");

		final var team = loader.load(directory);

		assertThat(team.calendars()).hasSize(2);
		assertThat(team.calendars().get(1).freeWeekdays()).containsExactlyInAnyOrder(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY, DayOfWeek.MONDAY);
		assertThat(team.capacity(MONDAY)).isEqualTo(0.5);
		assertThat(team.capacity(MONDAY.plusDays(1))).isEqualTo(1d);
		assertThat(team.capacity(MONDAY.plusDays(2))).isEqualTo(0.5);
		assertThat(team.capacity(MONDAY.plusDays(5))).isEqualTo(0d);
	}

	@Test
	void withoutDirectoryTheDefaultCalendarApplies() {
		assertThat(loader.apply(Optional.empty())).isEqualTo(TeamCalendar.defaultCalendar());
	}

	@Test
	void acceptsEveryWeekdaySpelling() {
		for (var spelling : new String[]{"tue", "Tues", "TUESDAY"}) {
			assertThat(TeamCalendarYamlLoader.parseWeekday(spelling, Path.of("c.yaml"))).isEqualTo(DayOfWeek.TUESDAY);
		}
		for (var spelling : new String[]{"thu", "thur", "thurs", "Thursday"}) {
			assertThat(TeamCalendarYamlLoader.parseWeekday(spelling, Path.of("c.yaml"))).isEqualTo(DayOfWeek.THURSDAY);
		}
	}

	@Test
	void rejectsUnknownWeekdays() {
		assertThatThrownBy(() -> loader.parse("free_weekdays: [Funday]", Path.of("c.yaml")))
				.isInstanceOf(ForecastException.class)
				.hasMessage("invalid weekday value in c.yaml: Funday");
	}

	@Test
	void rejectsRangesThatEndBeforeTheyStart() {
		assertThatThrownBy(() -> loader.parse("""
				free_date_ranges:
				  - start_date: 2026-03-10
				    end_date: 2026-03-01
				""", Path.of("c.yaml")))
				.isInstanceOf(ForecastException.class)
				.hasMessageContaining("is after end_date");
	}

	@Test
	void rejectsInvalidDates() {
		assertThatThrownBy(() -> loader.parse("""
				free_date_ranges:
				  - start_date: 2026/03/10
				    end_date: 2026-03-11
				""", Path.of("c.yaml")))
				.isInstanceOf(ForecastException.class)
				.hasMessageContaining("2026/03/10");
	}

	@Test
	void rejectsAMissingDirectory(@TempDir Path directory) {
		assertThatThrownBy(() -> loader.load(directory.resolve("absent")))
				.isInstanceOf(ForecastException.class)
				.hasMessageStartingWith("calendar directory not found");
	}

	@Test
	void rejectsAFileInPlaceOfTheDirectory(@TempDir Path directory) throws IOException {
		final var file = Files.writeString(directory.resolve("calendar.yaml"), "free_weekdays: []");
		assertThatThrownBy(() -> loader.load(file))
				.isInstanceOf(ForecastException.class)
				.hasMessageStartingWith("calendar directory not found");
	}

	@Test
	void rejectsADirectoryWithoutYamlFiles(@TempDir Path directory) {
		assertThatThrownBy(() -> loader.load(directory))
				.isInstanceOf(ForecastException.class)
				.hasMessageStartingWith("calendar directory contains no yaml files");
	}

	@Test
	void rejectsUnparseableFiles(@TempDir Path directory) throws IOException {
		Files.writeString(directory.resolve("broken.yaml"), "free_weekdays: [Sat\n");
		assertThatThrownBy(() -> loader.load(directory))
				.isInstanceOf(ForecastException.class)
				.hasMessageContaining("broken.yaml");
	}
}
