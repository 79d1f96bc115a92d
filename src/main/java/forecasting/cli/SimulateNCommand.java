package forecasting.cli;

import forecasting.config.ForecastingProperties;
import forecasting.global.Dates;
import forecasting.throughputsimulation.ThroughputSimulationUseCase;
import forecasting.yaml.SimulationReportYaml;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Scope;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.Callable;

@Component
@Scope("prototype")
@RequiredArgsConstructor
@CommandLine.Command(
		name = "simulate-n",
		description = "Simulates how long a number of issues takes by replaying the daily throughput history, and writes the report."
)
public class SimulateNCommand implements Callable<Integer> {

	private final ThroughputSimulationUseCase throughputSimulationUseCase;
	private final SimulationReportYaml simulationReportYaml;
	private final ForecastingProperties properties;

	@CommandLine.Spec
	private CommandLine.Model.CommandSpec spec;

	@CommandLine.Option(names = {"-f", "--file"}, required = true, description = "The throughput YAML file")
	private Path throughputFile;

	@CommandLine.Option(names = {"-o", "--output"}, required = true, description = "Where to write the simulation report YAML")
	private Path output;

	@CommandLine.Option(names = {"-i", "--iterations"}, required = true, description = "The number of trials")
	private int iterations;

	@CommandLine.Option(names = {"-n", "--number-of-issues"}, required = true, description = "How many issues remain to be done")
	private int numberOfIssues;

	@CommandLine.Option(names = {"-s", "--start-date"}, description = "The first day of work, as YYYY-MM-DD. Defaults to today")
	private String startDate;

	@CommandLine.Option(names = "--calendar-dir", description = "A directory with one calendar YAML file per team member")
	private Path calendarDirectory;

	@CommandLine.Option(names = "--seed", description = "Makes the simulation reproducible")
	private Long seed;

	@Override
	public Integer call() {
		final var simulation = throughputSimulationUseCase.execute(new ThroughputSimulationUseCase.Request(
				throughputFile,
				iterations,
				numberOfIssues,
				Optional.ofNullable(startDate).map(Dates::parse),
				Optional.ofNullable(calendarDirectory),
				seed != null ? OptionalLong.of(seed) : properties.seedValue()
		));
		simulationReportYaml.write(output, simulation.report());
		final var out = spec.commandLine().getOut();
		out.println(ReportFormatter.format(simulation));
		out.println("Simulation result for " + numberOfIssues + " items written to " + output);
		out.flush();
		return 0;
	}
}
