package forecasting.yaml;

import forecasting.global.Dates;
import forecasting.global.ForecastException;
import forecasting.global.SimulationReport;
import forecasting.global.SimulationReport.SimulationPercentile;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Dump;
import org.snakeyaml.engine.v2.api.DumpSettings;
import org.snakeyaml.engine.v2.common.FlowStyle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static forecasting.yaml.YamlDocuments.*;

/**
 * Reads and writes the persisted {@link SimulationReport}:
 * <pre>
 * data_source: project.yaml
 * start_date: 2026-02-16
 * velocity: 1.0
 * iterations: 10000
 * simulated_items: 4
 * p0: {days: 6.0, date: 2026-02-22}
 * ...
 * </pre>
 */
@Component
public class SimulationReportYaml {
	private static final Logger logger = LogManager.getLogger(SimulationReportYaml.class);

	private static final Dump DUMP = new Dump(DumpSettings.builder().setDefaultFlowStyle(FlowStyle.BLOCK).build());

	public SimulationReport read(final Path file) {
		return toReport(load(file), file);
	}

	public SimulationReport parse(final String text, final Path origin) {
		return toReport(YamlDocuments.parse(text, origin), origin);
	}

	public void write(final Path file, final SimulationReport report) {
		try {
			Files.writeString(file, dump(report));
		} catch (IOException e) {
			throw ForecastException.unwritableFile(file, e);
		}
		logger.debug("simulation report written to {}", file);
	}

	public String dump(final SimulationReport report) {
		final var root = new LinkedHashMap<String, Object>();
		root.put("data_source", report.dataSource());
		root.put("start_date", Dates.format(report.startDate()));
		root.put("velocity", report.velocity().isPresent() ? report.velocity().getAsDouble() : null);
		root.put("iterations", report.iterations());
		root.put("simulated_items", report.simulatedItems());
		root.put("p0", percentileNode(report.p0()));
		root.put("p50", percentileNode(report.p50()));
		root.put("p85", percentileNode(report.p85()));
		root.put("p100", percentileNode(report.p100()));
		return DUMP.dumpToString(root);
	}

	private static Map<String, Object> percentileNode(final SimulationPercentile percentile) {
		final var node = new LinkedHashMap<String, Object>();
		node.put("days", percentile.days());
		node.put("date", Dates.format(percentile.date()));
		return node;
	}

	private static SimulationReport toReport(final Object document, final Path origin) {
		final var root = asMap(document, origin, "simulation report");
		return new SimulationReport(
				requiredString(root, "data_source", origin),
				requiredDate(root, "start_date", origin),
				optionalNumber(root, "velocity", origin),
				requiredCount(root, "iterations", origin),
				requiredCount(root, "simulated_items", origin),
				percentile(root, "p0", origin),
				percentile(root, "p50", origin),
				percentile(root, "p85", origin),
				percentile(root, "p100", origin)
		);
	}

	private static SimulationPercentile percentile(final Map<String, Object> root, final String key, final Path origin) {
		final var value = root.get(key);
		if (value == null) {
			throw ForecastException.invalidYamlContent(origin, "missing field '" + key + "'");
		}
		final var node = asMap(value, origin, key);
		return new SimulationPercentile(requiredNumber(node, "days", origin), requiredDate(node, "date", origin));
	}
}
