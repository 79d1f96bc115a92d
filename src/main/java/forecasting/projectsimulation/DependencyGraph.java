package forecasting.projectsimulation;

import forecasting.global.ForecastException;
import forecasting.global.Project;
import forecasting.global.WorkItem;

import fj.data.List;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.PriorityQueue;

public interface DependencyGraph {

	/** Orders the work items of the specified project such that every item comes after all the items it depends on.
	 * When several items are ready at once, the one declared first in the project wins, so the order is deterministic.
	 * @return the ids of every work item of the project.
	 * @throws ForecastException if an id is blank or repeated, a dependency names an unknown item, or the dependencies form a cycle.
	 */
	static List<String> topologicalOrder(final Project project) {
		final var items = project.workPackages().toJavaList();
		final var indexById = new HashMap<String, Integer>();
		for (var index = 0; index < items.size(); ++index) {
			final var id = items.get(index).id();
			if (id == null || id.isBlank()) {
				throw ForecastException.missingItemId();
			}
			if (indexById.putIfAbsent(id, index) != null) {
				throw ForecastException.duplicateItemId(id);
			}
		}

		final var dependents = new ArrayList<java.util.List<Integer>>(items.size());
		final var pendingDependencies = new int[items.size()];
		for (var index = 0; index < items.size(); ++index) {
			dependents.add(new ArrayList<>());
		}
		for (var index = 0; index < items.size(); ++index) {
			final WorkItem item = items.get(index);
			for (var dependency : item.dependencies()) {
				final var dependencyIndex = indexById.get(dependency);
				if (dependencyIndex == null) {
					throw ForecastException.unknownDependency(item.id(), dependency);
				}
				dependents.get(dependencyIndex).add(index);
				pendingDependencies[index] += 1;
			}
		}

		final var ready = new PriorityQueue<Integer>();
		for (var index = 0; index < items.size(); ++index) {
			if (pendingDependencies[index] == 0) {
				ready.add(index);
			}
		}
		final var ordered = new ArrayList<String>(items.size());
		while (!ready.isEmpty()) {
			final int index = ready.poll();
			ordered.add(items.get(index).id());
			for (int dependent : dependents.get(index)) {
				pendingDependencies[dependent] -= 1;
				if (pendingDependencies[dependent] == 0) {
					ready.add(dependent);
				}
			}
		}
		if (ordered.size() < items.size()) {
			throw ForecastException.cyclicDependencies();
		}
		return List.iterableList(ordered);
	}
}
