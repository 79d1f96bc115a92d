package forecasting.global;

import java.time.LocalDate;
import java.util.OptionalDouble;
import java.util.function.DoubleFunction;

/**
 * The persisted outcome of a simulation. Other projects may consume it through a reference estimate.
 *
 * @param dataSource label of the input the simulation was fed with, usually its file name.
 * @param velocity story points per capacity-day, absent when no story points were simulated.
 * @param simulatedItems the number of work packages, or of issues for a throughput simulation.
 */
public record SimulationReport(
		String dataSource,
		LocalDate startDate,
		OptionalDouble velocity,
		int iterations,
		int simulatedItems,
		SimulationPercentile p0,
		SimulationPercentile p50,
		SimulationPercentile p85,
		SimulationPercentile p100
) {

	/**
	 * A completion estimate: the simulated days from the start date and the calendar date they map to.
	 */
	public record SimulationPercentile(double days, LocalDate date) {}

	/**
	 * A completion date is the start date plus the whole number of days needed to cover the percentile.
	 */
	public static LocalDate endDateFromDays(final LocalDate startDate, final double days) {
		return startDate.plusDays((long) Math.max(0d, Math.ceil(days)));
	}

	public static SimulationReport of(
			final String dataSource,
			final LocalDate startDate,
			final OptionalDouble velocity,
			final int iterations,
			final int simulatedItems,
			final Percentiles percentiles
	) {
		return of(dataSource, startDate, velocity, iterations, simulatedItems, percentiles, days -> endDateFromDays(startDate, days));
	}

	/**
	 * @param toDate maps a number of simulated days to the calendar date it ends on.
	 */
	public static SimulationReport of(
			final String dataSource,
			final LocalDate startDate,
			final OptionalDouble velocity,
			final int iterations,
			final int simulatedItems,
			final Percentiles percentiles,
			final DoubleFunction<LocalDate> toDate
	) {
		return new SimulationReport(
				dataSource,
				startDate,
				velocity,
				iterations,
				simulatedItems,
				new SimulationPercentile(percentiles.p0(), toDate.apply(percentiles.p0())),
				new SimulationPercentile(percentiles.p50(), toDate.apply(percentiles.p50())),
				new SimulationPercentile(percentiles.p85(), toDate.apply(percentiles.p85())),
				new SimulationPercentile(percentiles.p100(), toDate.apply(percentiles.p100()))
		);
	}

	public SimulationReport withDataSource(final String newDataSource) {
		return new SimulationReport(newDataSource, startDate, velocity, iterations, simulatedItems, p0, p50, p85, p100);
	}

	/**
	 * The triplet another project borrows when it references this report: p0, p50 and p100 days.
	 */
	public Estimate.ThreePoint asThreePointEstimate() {
		return new Estimate.ThreePoint(p0.days(), p50.days(), p100.days());
	}
}
