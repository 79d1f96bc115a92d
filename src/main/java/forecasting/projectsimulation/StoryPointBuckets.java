package forecasting.projectsimulation;

import forecasting.global.Estimate.ThreePoint;

/**
 * Turns a single story point value into a triplet bounded by the surrounding terms of the Fibonacci-like planning-poker series.
 */
final class StoryPointBuckets {
	private StoryPointBuckets() {}

	private static final double[] SERIES = {0, 1, 2, 3, 5, 8, 13, 21, 34, 55, 89, 144, 233, 377, 610, 987};

	/**
	 * Values up to the first term fall in the first bucket; any other value falls in the first bucket whose upper term is not below it
	 * (so a value on a term is the top of its bucket); values beyond the last term collapse onto it.
	 * @return {@code (lower, value, upper)}.
	 */
	static ThreePoint triplet(final double value) {
		if (value <= SERIES[0]) {
			return new ThreePoint(SERIES[0], value, SERIES[1]);
		}
		for (var i = 1; i < SERIES.length; ++i) {
			if (value <= SERIES[i]) {
				return new ThreePoint(SERIES[i - 1], value, SERIES[i]);
			}
		}
		final var last = SERIES[SERIES.length - 1];
		return new ThreePoint(last, value, last);
	}
}
