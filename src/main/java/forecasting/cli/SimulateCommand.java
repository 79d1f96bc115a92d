package forecasting.cli;

import forecasting.config.ForecastingProperties;
import forecasting.global.Dates;
import forecasting.projectsimulation.ProjectSimulationUseCase;
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
		name = "simulate",
		description = "Simulates a project file, following the dependencies between its work items, and writes the report."
)
public class SimulateCommand implements Callable<Integer> {

	private final ProjectSimulationUseCase projectSimulationUseCase;
	private final SimulationReportYaml simulationReportYaml;
	private final ForecastingProperties properties;

	@CommandLine.Spec
	private CommandLine.Model.CommandSpec spec;

	@CommandLine.Option(names = {"-i", "--input"}, required = true, description = "The project YAML file")
	private Path input;

	@CommandLine.Option(names = {"-o", "--output"}, required = true, description = "Where to write the simulation report YAML")
	private Path output;

	@CommandLine.Option(names = {"-s", "--start-date"}, description = "The first day of work, as YYYY-MM-DD. Defaults to today")
	private String startDate;

	@CommandLine.Option(names = "--iterations", description = "The number of trials. Defaults to forecasting.simulation.iterations")
	private Integer iterations;

	@CommandLine.Option(names = "--calendar-dir", description = "A directory with one calendar YAML file per team member")
	private Path calendarDirectory;

	@CommandLine.Option(names = "--seed", description = "Makes the simulation reproducible")
	private Long seed;

	@CommandLine.Option(names = "--workers", description = "The number of threads that share the trials")
	private Integer workers;

	@Override
	public Integer call() {
		final var simulation = projectSimulationUseCase.execute(new ProjectSimulationUseCase.Request(
				input,
				iterations != null ? iterations : properties.getIterations(),
				Optional.ofNullable(startDate).map(Dates::parse),
				Optional.ofNullable(calendarDirectory),
				seed != null ? OptionalLong.of(seed) : properties.seedValue(),
				workers != null ? workers : properties.getWorkers()
		));
		simulationReportYaml.write(output, simulation.report());
		final var out = spec.commandLine().getOut();
		out.println(ReportFormatter.format(simulation));
		out.println("Simulation result written to " + output);
		out.flush();
		return 0;
	}
}
