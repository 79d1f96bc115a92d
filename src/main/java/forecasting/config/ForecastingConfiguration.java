package forecasting.config;

import forecasting.projectsimulation.BetaPertSampler;
import forecasting.projectsimulation.ThreePointSampler;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.context.support.PropertySourcesPlaceholderConfigurer;

import java.util.OptionalLong;
import java.util.function.BiFunction;
import java.util.function.Function;

@Configuration
@ComponentScan("forecasting")
@PropertySource("classpath:forecasting.properties")
public class ForecastingConfiguration {

	@Bean
	public static PropertySourcesPlaceholderConfigurer propertySourcesPlaceholderConfigurer() {
		return new PropertySourcesPlaceholderConfigurer();
	}

	/** Gives each simulation worker its own Beta-PERT sampler, reproducible when a seed is given. */
	@Bean
	public BiFunction<OptionalLong, Integer, ThreePointSampler> samplerSupplier() {
		return BetaPertSampler::forStream;
	}

	@Bean
	public Function<OptionalLong, UniformRandomProvider> randomSupplier() {
		return seed -> seed.isPresent()
				? RandomSource.XO_SHI_RO_256_PP.create(seed.getAsLong())
				: RandomSource.XO_SHI_RO_256_PP.create();
	}
}
