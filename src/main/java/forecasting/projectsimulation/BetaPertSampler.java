package forecasting.projectsimulation;

import forecasting.global.ForecastException;
import lombok.RequiredArgsConstructor;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ChengBetaSampler;
import org.apache.commons.rng.simple.RandomSource;

import java.util.OptionalLong;

/**
 * Samples a triplet with the PERT parameterization of the Beta distribution: {@code α = 1 + 4 (m - o) / (p - o)} and
 * {@code β = 1 + 4 (p - m) / (p - o)}, rescaled into {@code [o, p]}. The mass concentrates near the most likely value while respecting the
 * bounds.
 * <p>Not thread safe: each worker owns its generator.
 */
@RequiredArgsConstructor
public class BetaPertSampler implements ThreePointSampler {
	private static final RandomSource ALGORITHM = RandomSource.XO_SHI_RO_256_PP;

	private final UniformRandomProvider rng;

	public static BetaPertSampler seeded(final long seed) {
		return new BetaPertSampler(ALGORITHM.create(seed));
	}

	public static BetaPertSampler unseeded() {
		return new BetaPertSampler(ALGORITHM.create());
	}

	/**
	 * Creates the sampler of one worker. Workers of a seeded run get distinct but reproducible streams.
	 */
	public static BetaPertSampler forStream(final OptionalLong seed, final int stream) {
		return seed.isPresent() ? seeded(seed.getAsLong() + stream) : unseeded();
	}

	@Override
	public double sample(final double optimistic, final double mostLikely, final double pessimistic) {
		if (pessimistic < optimistic) {
			throw ForecastException.invalidTriplet(optimistic, mostLikely, pessimistic);
		}
		final var range = pessimistic - optimistic;
		if (range < COLLAPSED_RANGE) {
			return optimistic;
		}
		if (mostLikely < optimistic || mostLikely > pessimistic) {
			throw ForecastException.invalidTriplet(optimistic, mostLikely, pessimistic);
		}
		final var alpha = 1 + 4 * (mostLikely - optimistic) / range;
		final var beta = 1 + 4 * (pessimistic - mostLikely) / range;
		final var unit = ChengBetaSampler.of(rng, alpha, beta).sample();
		return optimistic + unit * range;
	}

	private static final double COLLAPSED_RANGE = 1e-7;
}
