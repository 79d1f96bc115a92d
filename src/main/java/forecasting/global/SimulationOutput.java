package forecasting.global;

import fj.data.List;

import java.util.Optional;

/**
 * Everything a simulation produces.
 *
 * @param results the simulated total durations in ascending order, one per trial.
 * @param workPackages per item percentiles; absent for simulations that have no dependency graph.
 */
public record SimulationOutput(SimulationReport report, double[] results, Optional<List<WorkPackageSimulation>> workPackages) {

	/**
	 * Percentiles of the finish time, in days from the start date, of one work item.
	 */
	public record WorkPackageSimulation(String id, Percentiles percentiles) {}

	public SimulationOutput withDataSource(final String dataSource) {
		return new SimulationOutput(report.withDataSource(dataSource), results, workPackages);
	}
}
