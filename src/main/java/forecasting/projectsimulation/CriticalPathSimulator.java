package forecasting.projectsimulation;

import forecasting.global.Estimate;
import forecasting.global.Estimate.ThreePoint;
import forecasting.global.ForecastException;
import forecasting.global.Percentiles;
import forecasting.global.Project;
import forecasting.global.SimulationOutput;
import forecasting.global.SimulationOutput.WorkPackageSimulation;
import forecasting.global.SimulationReport;
import forecasting.global.TeamCalendar;
import forecasting.global.WorkItem;

import fj.data.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.IntFunction;

/**
 * Monte Carlo simulation of a project's critical path. Each trial samples every work item once, in topological order, and a work item
 * starts when the last of its dependencies finishes. The duration of the trial is the latest finish.
 * <p>Story point estimates are effort: the sample divided by the velocity is consumed from the team calendar, so days without capacity
 * stretch the elapsed time. Three-point and reference estimates are elapsed days and are added as they are.
 */
public final class CriticalPathSimulator {
	private static final Logger logger = LogManager.getLogger(CriticalPathSimulator.class);

	private CriticalPathSimulator() {}

	/**
	 * A work item laid out for simulation.
	 * @param effort whether the sample is effort to be divided by the velocity and spread over the calendar.
	 * @param dependencies the positions, within the plan, of the items this one waits for. Always lower than its own position.
	 */
	public record SimulationNode(String id, ThreePoint triplet, boolean effort, int[] dependencies) {}

	/** The validated project, its items laid out in topological order. Immutable, so many workers may share it. */
	public record SimulationPlan(SimulationNode[] nodes, OptionalDouble velocity, LocalDate startDate, TeamCalendar calendar) {}

	/**
	 * The raw outcome of a batch of trials.
	 * @param totals the duration of each trial.
	 * @param finishes the finish offset of each node, indexed by the node position and then by the trial.
	 */
	public record TrialSamples(double[] totals, double[][] finishes) {

		public int trials() {
			return totals.length;
		}

		/** Concatenates the trials of the specified batches, which must come from the same plan. */
		public static TrialSamples merge(final java.util.List<TrialSamples> batches) {
			final var trials = batches.stream().mapToInt(TrialSamples::trials).sum();
			final var nodes = batches.isEmpty() ? 0 : batches.get(0).finishes().length;
			final var totals = new double[trials];
			final var finishes = new double[nodes][trials];
			var offset = 0;
			for (var batch : batches) {
				System.arraycopy(batch.totals(), 0, totals, offset, batch.trials());
				for (var node = 0; node < nodes; ++node) {
					System.arraycopy(batch.finishes()[node], 0, finishes[node], offset, batch.trials());
				}
				offset += batch.trials();
			}
			return new TrialSamples(totals, finishes);
		}
	}

	/**
	 * Simulates the specified project on the current thread.
	 * @param order the ids of every work item, each after its dependencies. See {@link DependencyGraph#topologicalOrder(Project)}.
	 * @param velocity story points per capacity-day; required only when some item is estimated in story points.
	 */
	public static SimulationOutput simulate(
			final Project project,
			final List<String> order,
			final OptionalDouble velocity,
			final int iterations,
			final LocalDate startDate,
			final ThreePointSampler sampler,
			final TeamCalendar calendar
	) {
		if (iterations <= 0) {
			throw ForecastException.invalidIterations();
		}
		if (project.workPackages().isEmpty()) {
			throw ForecastException.emptyProject();
		}
		final var plan = prepare(project, order, velocity, startDate, calendar);
		return aggregate(project.name(), plan, runTrials(plan, iterations, sampler));
	}

	/**
	 * Validates every work item and lays the project out for simulation. All the checks happen here so that the trials never fail.
	 * @throws ForecastException if an item has no estimate, an unresolved reference, an inconsistent triplet, or story points without a
	 * positive velocity; or if a dependency is unknown.
	 */
	public static SimulationPlan prepare(
			final Project project,
			final List<String> order,
			final OptionalDouble velocity,
			final LocalDate startDate,
			final TeamCalendar calendar
	) {
		final var itemsById = new HashMap<String, WorkItem>();
		for (var item : project.workPackages()) {
			itemsById.put(item.id(), item);
		}
		final var positionById = new HashMap<String, Integer>();
		final var nodes = new SimulationNode[order.length()];
		var position = 0;
		for (var id : order) {
			final var item = itemsById.get(id);
			if (item == null) {
				throw new IllegalArgumentException("the order names the work item " + id + " which the project lacks");
			}
			final var dependencies = new int[item.dependencies().length()];
			var index = 0;
			for (var dependency : item.dependencies()) {
				final var dependencyPosition = positionById.get(dependency);
				if (dependencyPosition == null) {
					if (itemsById.containsKey(dependency)) {
						throw new IllegalArgumentException("the order places " + id + " before its dependency " + dependency);
					}
					throw ForecastException.unknownDependency(id, dependency);
				}
				dependencies[index++] = dependencyPosition;
			}
			nodes[position] = nodeOf(item, dependencies, velocity);
			positionById.put(id, position);
			position += 1;
		}
		return new SimulationPlan(nodes, velocity, startDate, calendar);
	}

	private static SimulationNode nodeOf(final WorkItem item, final int[] dependencies, final OptionalDouble velocity) {
		final var estimate = item.getEstimate().orElseThrow(() -> ForecastException.missingEstimate(item.id()));
		final ThreePoint triplet;
		final boolean effort;
		if (estimate instanceof Estimate.StoryPoints storyPoints) {
			if (velocity.isEmpty()) {
				throw ForecastException.missingVelocity(item.id());
			}
			if (!(velocity.getAsDouble() > 0)) {
				throw ForecastException.invalidVelocityValue(velocity.getAsDouble());
			}
			triplet = StoryPointBuckets.triplet(storyPoints.value());
			effort = true;
		} else if (estimate instanceof ThreePoint threePoint) {
			triplet = threePoint;
			effort = false;
		} else {
			final var reference = (Estimate.Reference) estimate;
			triplet = reference.cachedEstimate()
					.orElseThrow(() -> ForecastException.unresolvedReference(item.id(), reference.reportFilePath()));
			effort = false;
		}
		if (!triplet.isConsistent()) {
			throw ForecastException.invalidEstimate(
					item.id(),
					"optimistic=" + triplet.optimistic()
							+ ", most_likely=" + triplet.mostLikely()
							+ ", pessimistic=" + triplet.pessimistic()
			);
		}
		return new SimulationNode(item.id(), triplet, effort, dependencies);
	}

	/** Runs the specified number of trials of the plan with the specified sampler. */
	public static TrialSamples runTrials(final SimulationPlan plan, final int iterations, final ThreePointSampler sampler) {
		final var nodes = plan.nodes();
		final var timeline = new CapacityTimeline(plan.calendar(), plan.startDate());
		final var velocity = plan.velocity().orElse(Double.NaN);
		final var totals = new double[iterations];
		final var finishes = new double[nodes.length][iterations];
		final var finish = new double[nodes.length];
		for (var trial = 0; trial < iterations; ++trial) {
			var total = 0d;
			for (var position = 0; position < nodes.length; ++position) {
				final var node = nodes[position];
				var ready = 0d;
				for (int dependency : node.dependencies()) {
					ready = Math.max(ready, finish[dependency]);
				}
				final var sample = sampler.sample(node.triplet());
				final var end = node.effort()
						? timeline.finishOffset(ready, sample / velocity)
						: ready + sample;
				finish[position] = end;
				finishes[position][trial] = end;
				total = Math.max(total, end);
			}
			totals[trial] = total;
		}
		return new TrialSamples(totals, finishes);
	}

	/**
	 * Spreads the trials over the specified number of threads and merges their samples. Every worker owns the sampler the specified
	 * function gives for its index.
	 */
	public static TrialSamples runTrials(
			final SimulationPlan plan,
			final int iterations,
			final int workers,
			final IntFunction<? extends ThreePointSampler> samplerOfWorker
	) {
		if (workers <= 0) {
			throw ForecastException.invalidWorkers();
		}
		final var effectiveWorkers = Math.min(workers, iterations);
		if (effectiveWorkers <= 1) {
			return runTrials(plan, iterations, samplerOfWorker.apply(0));
		}
		logger.debug("spreading {} trials over {} workers", iterations, effectiveWorkers);
		final var executor = Executors.newFixedThreadPool(effectiveWorkers);
		try {
			final var futures = new ArrayList<Future<TrialSamples>>(effectiveWorkers);
			for (var worker = 0; worker < effectiveWorkers; ++worker) {
				final var share = iterations / effectiveWorkers + (worker < iterations % effectiveWorkers ? 1 : 0);
				final var sampler = samplerOfWorker.apply(worker);
				futures.add(executor.submit(() -> runTrials(plan, share, sampler)));
			}
			final var batches = new ArrayList<TrialSamples>(effectiveWorkers);
			for (var future : futures) {
				batches.add(future.get());
			}
			return TrialSamples.merge(batches);
		} catch (ExecutionException e) {
			if (e.getCause() instanceof RuntimeException runtimeException) {
				throw runtimeException;
			}
			throw new IllegalStateException("a simulation worker failed", e.getCause());
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("interrupted while waiting for the simulation workers", e);
		} finally {
			executor.shutdownNow();
		}
	}

	/** Computes the percentiles of the trial durations and of the finish of each node. */
	public static SimulationOutput aggregate(final String dataSource, final SimulationPlan plan, final TrialSamples samples) {
		final var totals = samples.totals().clone();
		Arrays.sort(totals);
		final var report = SimulationReport.of(
				dataSource,
				plan.startDate(),
				plan.velocity(),
				totals.length,
				plan.nodes().length,
				Percentiles.ofSorted(totals)
		);
		final var nodes = plan.nodes();
		final var workPackages = List.range(0, nodes.length)
				.map(position -> new WorkPackageSimulation(nodes[position].id(), Percentiles.of(samples.finishes()[position])));
		return new SimulationOutput(report, totals, Optional.of(workPackages));
	}
}
