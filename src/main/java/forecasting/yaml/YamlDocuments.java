package forecasting.yaml;

import forecasting.global.Dates;
import forecasting.global.ForecastException;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Reads YAML documents into the generic tree of maps, lists and scalars, and extracts typed values from that tree. Every failure becomes
 * an input {@link ForecastException} naming the file.
 */
final class YamlDocuments {
	private YamlDocuments() {}

	static Object load(final Path file) {
		final String text;
		try {
			text = Files.readString(file);
		} catch (IOException e) {
			throw ForecastException.unreadableFile(file, e);
		}
		return parse(text, file);
	}

	static Object parse(final String text, final Path origin) {
		final var load = new Load(LoadSettings.builder().setLabel(String.valueOf(origin)).build());
		try {
			return load.loadFromString(text);
		} catch (YamlEngineException e) {
			throw ForecastException.unparseableYaml(origin, e);
		}
	}

	@SuppressWarnings("unchecked")
	static Map<String, Object> asMap(final Object node, final Path origin, final String what) {
		if (node instanceof Map<?, ?> map) {
			return (Map<String, Object>) map;
		}
		throw ForecastException.invalidYamlContent(origin, what + " must be a mapping");
	}

	/** An absent or null node reads as an empty list. */
	static List<?> asList(final Object node, final Path origin, final String what) {
		if (node == null) {
			return List.of();
		}
		if (node instanceof List<?> list) {
			return list;
		}
		throw ForecastException.invalidYamlContent(origin, what + " must be a sequence");
	}

	static Optional<String> optionalString(final Map<String, Object> map, final String key, final Path origin) {
		final var value = map.get(key);
		if (value == null) {
			return Optional.empty();
		}
		if (value instanceof Map || value instanceof List) {
			throw ForecastException.invalidYamlContent(origin, "'" + key + "' must be a scalar");
		}
		return Optional.of(String.valueOf(value));
	}

	static String requiredString(final Map<String, Object> map, final String key, final Path origin) {
		return optionalString(map, key, origin)
				.orElseThrow(() -> ForecastException.invalidYamlContent(origin, "missing field '" + key + "'"));
	}

	static OptionalDouble optionalNumber(final Map<String, Object> map, final String key, final Path origin) {
		final var value = map.get(key);
		if (value == null) {
			return OptionalDouble.empty();
		}
		if (value instanceof Number number) {
			return OptionalDouble.of(number.doubleValue());
		}
		throw ForecastException.invalidYamlContent(origin, "'" + key + "' must be a number but was " + value);
	}

	static double requiredNumber(final Map<String, Object> map, final String key, final Path origin) {
		final var number = optionalNumber(map, key, origin);
		if (number.isEmpty()) {
			throw ForecastException.invalidYamlContent(origin, "missing field '" + key + "'");
		}
		return number.getAsDouble();
	}

	static int requiredCount(final Map<String, Object> map, final String key, final Path origin) {
		final var value = requiredNumber(map, key, origin);
		if (value < 0 || value != Math.rint(value) || value > Integer.MAX_VALUE) {
			throw ForecastException.invalidYamlContent(origin, "'" + key + "' must be a non-negative integer but was " + value);
		}
		return (int) value;
	}

	static Optional<LocalDate> optionalDate(final Map<String, Object> map, final String key, final Path origin) {
		return optionalString(map, key, origin).map(Dates::parse);
	}

	static LocalDate requiredDate(final Map<String, Object> map, final String key, final Path origin) {
		return Dates.parse(requiredString(map, key, origin));
	}
}
