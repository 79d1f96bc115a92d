package forecasting.cli;

import forecasting.config.ForecastingConfiguration;
import forecasting.global.ForecastException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import picocli.CommandLine;

public final class ForecastsMain {
	private static final Logger logger = LogManager.getLogger(ForecastsMain.class);

	private ForecastsMain() {}

	public static void main(final String[] args) {
		final int exitCode;
		try (var context = new AnnotationConfigApplicationContext(ForecastingConfiguration.class)) {
			exitCode = commandLine(context).execute(args);
		}
		System.exit(exitCode);
	}

	/**
	 * Builds the {@code forecasts} command line with its subcommands obtained from the specified context. A failing command prints its
	 * message to the error stream and exits with code 1.
	 */
	public static CommandLine commandLine(final ApplicationContext context) {
		return new CommandLine(ForecastsCommand.class, new SpringCommandFactory(context))
				.setExecutionExceptionHandler(ForecastsMain::handleExecutionException);
	}

	private static int handleExecutionException(
			final Exception exception,
			final CommandLine commandLine,
			final CommandLine.ParseResult parseResult
	) {
		if (exception instanceof ForecastException forecastException) {
			logger.debug("{} failure", forecastException.getKind(), forecastException);
		} else {
			logger.error("unexpected failure", exception);
		}
		commandLine.getErr().println("Error: " + exception.getMessage());
		commandLine.getErr().flush();
		return commandLine.getCommandSpec().exitCodeOnExecutionException();
	}
}
