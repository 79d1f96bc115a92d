package forecasting.yaml;

import forecasting.global.Throughput;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static forecasting.yaml.YamlDocuments.*;

/**
 * Loads the daily throughput history, a sequence of {@code {date: 2026-02-09, completed_issues: 5}} entries.
 */
@Component
public class ThroughputYamlReader implements Function<Path, List<Throughput>> {

	@Override
	public List<Throughput> apply(final Path file) {
		return toThroughput(load(file), file);
	}

	public List<Throughput> parse(final String text, final Path origin) {
		return toThroughput(YamlDocuments.parse(text, origin), origin);
	}

	private static List<Throughput> toThroughput(final Object document, final Path origin) {
		final var throughput = new ArrayList<Throughput>();
		for (var node : asList(document, origin, "throughput")) {
			final var entry = asMap(node, origin, "throughput entry");
			throughput.add(new Throughput(requiredDate(entry, "date", origin), requiredCount(entry, "completed_issues", origin)));
		}
		return List.copyOf(throughput);
	}
}
