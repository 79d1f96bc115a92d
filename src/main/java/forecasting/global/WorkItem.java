package forecasting.global;

import fj.data.List;

import java.time.LocalDate;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * A unit of work of a {@link Project}. Immutable once loaded.
 *
 * @param id unique identifier within the project.
 * @param estimate the size of the item; {@code null} when the source declares none.
 * @param dependencies ids of the items that must finish before this one starts, already resolved from the file conventions.
 * @param subgraph an optional grouping label carried along for diagram tools.
 */
public record WorkItem(
		String id,
		String summary,
		String description,
		Estimate estimate,
		List<String> dependencies,
		Status status,
		LocalDate createdDate,
		LocalDate startDate,
		LocalDate doneDate,
		String subgraph
) {

	public WorkItem {
		if (dependencies == null) {
			dependencies = List.nil();
		}
	}

	public static WorkItem of(final String id, final Estimate estimate, final List<String> dependencies) {
		return new WorkItem(id, null, null, estimate, dependencies, null, null, null, null, null);
	}

	public static WorkItem done(final String id, final Estimate estimate, final LocalDate startDate, final LocalDate doneDate) {
		return new WorkItem(id, null, null, estimate, List.nil(), Status.Done, null, startDate, doneDate, null);
	}

	public Optional<Estimate> getEstimate() {
		return Optional.ofNullable(estimate);
	}

	public OptionalDouble storyPointValue() {
		return estimate instanceof Estimate.StoryPoints storyPoints
				? OptionalDouble.of(storyPoints.value())
				: OptionalDouble.empty();
	}

	public boolean isDone() {
		return status == Status.Done;
	}
}
