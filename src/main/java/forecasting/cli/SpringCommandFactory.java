package forecasting.cli;

import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationContext;
import picocli.CommandLine;

/**
 * Lets picocli obtain the commands from the Spring context, so that they get their use cases injected. Anything else picocli needs to
 * instantiate is left to its default factory.
 */
@RequiredArgsConstructor
public class SpringCommandFactory implements CommandLine.IFactory {
	private final ApplicationContext context;

	@Override
	public <K> K create(final Class<K> cls) throws Exception {
		if (context.getBeanNamesForType(cls).length > 0) {
			return context.getBean(cls);
		}
		return CommandLine.defaultFactory().create(cls);
	}
}
