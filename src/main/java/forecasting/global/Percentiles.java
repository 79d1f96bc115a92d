package forecasting.global;

import java.util.Arrays;

/**
 * Nearest-rank percentiles over an ascending sample: the value at the rounded position {@code (p / 100) * (n - 1)}, the first value for
 * {@code p <= 0} and the last one for {@code p >= 100}.
 *
 * @param p0 the minimum.
 * @param p50 the median.
 * @param p85 the value 85% of the sample does not exceed.
 * @param p100 the maximum.
 */
public record Percentiles(double p0, double p50, double p85, double p100) {

	public static final Percentiles ZERO = new Percentiles(0, 0, 0, 0);

	/**
	 * @param sortedValues a sample in ascending order.
	 * @return the nearest-rank percentile, or 0 for an empty sample.
	 */
	public static double valueOfSorted(final double[] sortedValues, final double percentile) {
		if (sortedValues.length == 0) {
			return 0d;
		}
		final int index;
		if (percentile <= 0) {
			index = 0;
		} else if (percentile >= 100) {
			index = sortedValues.length - 1;
		} else {
			index = (int) Math.round((percentile / 100d) * (sortedValues.length - 1));
		}
		return sortedValues[index];
	}

	public static Percentiles ofSorted(final double[] sortedValues) {
		return new Percentiles(
				valueOfSorted(sortedValues, 0),
				valueOfSorted(sortedValues, 50),
				valueOfSorted(sortedValues, 85),
				valueOfSorted(sortedValues, 100)
		);
	}

	/**
	 * Like {@link #ofSorted(double[])} but for a sample in any order. The received array is not modified.
	 */
	public static Percentiles of(final double[] values) {
		if (values.length == 0) {
			return ZERO;
		}
		final var sorted = values.clone();
		Arrays.sort(sorted);
		return ofSorted(sorted);
	}
}
