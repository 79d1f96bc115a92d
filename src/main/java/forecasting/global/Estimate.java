package forecasting.global;

import java.util.Optional;

/**
 * How uncertain the size of a {@link WorkItem} is. One of {@link StoryPoints}, {@link ThreePoint} or {@link Reference}.
 */
public sealed interface Estimate permits Estimate.StoryPoints, Estimate.ThreePoint, Estimate.Reference {

	/**
	 * Effort expressed in velocity-normalised points. It becomes a duration only through the team's velocity.
	 */
	record StoryPoints(double value) implements Estimate {}

	/**
	 * A duration in elapsed days given by its optimistic, most likely and pessimistic values.
	 */
	record ThreePoint(double optimistic, double mostLikely, double pessimistic) implements Estimate {
		private static final double COLLAPSE_TOLERANCE = 1e-7;

		public static ThreePoint constant(final double days) {
			return new ThreePoint(days, days, days);
		}

		public boolean isCollapsed() {
			return Math.abs(pessimistic - optimistic) < COLLAPSE_TOLERANCE;
		}

		/**
		 * A triplet is consistent when the pessimistic value is not below the optimistic one and, unless the range is collapsed to a
		 * point, the most likely value lies between them.
		 */
		public boolean isConsistent() {
			if (pessimistic < optimistic) {
				return false;
			} else {
				return isCollapsed() || (optimistic <= mostLikely && mostLikely <= pessimistic);
			}
		}
	}

	/**
	 * Borrows the p0/p50/p100 days of another project's persisted simulation report. The report is read once, when the project is loaded,
	 * and the resulting triplet is cached here; an empty cache means the report could not be resolved.
	 */
	record Reference(String reportFilePath, Optional<ThreePoint> cachedEstimate) implements Estimate {

		public static Reference unresolved(final String reportFilePath) {
			return new Reference(reportFilePath, Optional.empty());
		}
	}
}
