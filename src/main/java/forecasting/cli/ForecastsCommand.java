package forecasting.cli;

import picocli.CommandLine;

@CommandLine.Command(
		name = "forecasts",
		mixinStandardHelpOptions = true,
		version = "forecasts 0.1.0",
		description = "Forecasts when a project, or a number of issues, will be done by Monte Carlo simulation.",
		subcommands = {SimulateCommand.class, SimulateNCommand.class, CommandLine.HelpCommand.class},
		exitCodeListHeading = "Exit Codes:%n",
		exitCodeList = {
				"0: the simulation report was written",
				"1: the simulation failed"
		}
)
public class ForecastsCommand implements Runnable {

	@CommandLine.Spec
	private CommandLine.Model.CommandSpec spec;

	@Override
	public void run() {
		spec.commandLine().usage(spec.commandLine().getOut());
	}
}
