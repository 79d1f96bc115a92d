package forecasting.projectsimulation;

import forecasting.global.Estimate.ThreePoint;
import forecasting.global.ForecastException;

/**
 * Specifies what the {@link CriticalPathSimulator} needs to draw one plausible value from an (optimistic, most likely, pessimistic)
 * triplet.
 * <p>Implementations must fail with a {@link ForecastException} when the pessimistic value is below the optimistic one, must return the
 * optimistic value without drawing when the range is collapsed to a point, and must fail when the most likely value lies outside the
 * range.
 */
@FunctionalInterface
public interface ThreePointSampler {

	double sample(double optimistic, double mostLikely, double pessimistic);

	default double sample(final ThreePoint triplet) {
		return sample(triplet.optimistic(), triplet.mostLikely(), triplet.pessimistic());
	}

	/**
	 * A deterministic sampler that always answers the most likely value.
	 */
	static ThreePointSampler mostLikely() {
		return (optimistic, mostLikely, pessimistic) -> {
			final var triplet = new ThreePoint(optimistic, mostLikely, pessimistic);
			if (!triplet.isConsistent()) {
				throw ForecastException.invalidTriplet(optimistic, mostLikely, pessimistic);
			}
			return triplet.isCollapsed() ? optimistic : mostLikely;
		};
	}
}
