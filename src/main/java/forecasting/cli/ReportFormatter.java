package forecasting.cli;

import forecasting.global.Dates;
import forecasting.global.SimulationOutput;
import forecasting.global.SimulationReport;
import forecasting.global.SimulationReport.SimulationPercentile;

import java.util.Locale;
import java.util.StringJoiner;

/**
 * Renders a simulation as the plain text the commands print.
 */
public final class ReportFormatter {
	private ReportFormatter() {}

	public static String format(final SimulationOutput output) {
		final var text = new StringJoiner("\n");
		text.add(format(output.report()));
		output.workPackages().ifPresent(workPackages -> {
			text.add("");
			text.add("Work packages:");
			text.add("Id | P0 | P50 | P85 | P100");
			text.add("---|----|-----|-----|-----");
			for (var workPackage : workPackages) {
				final var percentiles = workPackage.percentiles();
				text.add(workPackage.id()
						+ " | " + days(percentiles.p0())
						+ " | " + days(percentiles.p50())
						+ " | " + days(percentiles.p85())
						+ " | " + days(percentiles.p100()));
			}
		});
		return text.toString();
	}

	public static String format(final SimulationReport report) {
		final var text = new StringJoiner("\n");
		text.add("Simulation Report");
		text.add("Data source: " + report.dataSource());
		text.add("Start date: " + Dates.format(report.startDate()));
		text.add("Iterations: " + report.iterations());
		text.add("Simulated items: " + report.simulatedItems());
		text.add("Velocity: " + (report.velocity().isPresent() ? days(report.velocity().getAsDouble()) : "n/a"));
		text.add("");
		text.add("Percentiles:");
		text.add("Percentile | Days | Date");
		text.add("-----------|------|-----");
		text.add(row("P0", report.p0()));
		text.add(row("P50", report.p50()));
		text.add(row("P85", report.p85()));
		text.add(row("P100", report.p100()));
		return text.toString();
	}

	private static String row(final String label, final SimulationPercentile percentile) {
		return label + " | " + days(percentile.days()) + " | " + Dates.format(percentile.date());
	}

	private static String days(final double value) {
		return String.format(Locale.ROOT, "%.2f", value);
	}
}
