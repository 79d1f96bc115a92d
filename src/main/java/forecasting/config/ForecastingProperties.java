package forecasting.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.OptionalLong;

/**
 * The defaults of the simulation options, read from {@code forecasting.properties}. Command line options override them.
 */
@Component
@Getter
public class ForecastingProperties {

	@Value("${forecasting.simulation.iterations:10000}")
	private int iterations;

	@Value("${forecasting.simulation.workers:1}")
	private int workers;

	@Value("${forecasting.simulation.seed:}")
	private String seed;

	/** The configured seed; absent when the property is blank. */
	public OptionalLong seedValue() {
		return seed == null || seed.isBlank() ? OptionalLong.empty() : OptionalLong.of(Long.parseLong(seed.trim()));
	}
}
