package forecasting.projectsimulation;

import forecasting.global.ForecastException;
import forecasting.global.Project;
import forecasting.global.TeamCalendar;
import forecasting.global.WorkItem;

import fj.Ord;
import fj.data.List;

import java.time.LocalDate;

/**
 * Derives the team's velocity, in story points per capacity-day, from the completed work of a project.
 */
public final class VelocityCalculator {
	private VelocityCalculator() {}

	/** How many of the most recently finished items the velocity is measured over. */
	static final int HISTORY_SIZE = 30;

	private static final Ord<LocalDate> DATE_ORD = Ord.longOrd.contramap(LocalDate::toEpochDay);
	private static final Ord<WorkItem> BY_DONE_DATE = DATE_ORD.contramap(WorkItem::doneDate);

	/**
	 * Considers the done items with a story point estimate and both a start and a done date. Of them, the {@value #HISTORY_SIZE} with the
	 * latest done dates are kept, and the sum of their points is divided by the capacity the calendar offers from the earliest start date
	 * to the latest done date, both inclusive.
	 * @throws ForecastException if no item qualifies, if the calendar offers no capacity in the window, or if the result is not positive.
	 */
	public static double calculate(final Project project, final TeamCalendar calendar) {
		final var eligible = project.workPackages()
				.filter(item -> item.isDone()
						&& item.storyPointValue().isPresent()
						&& item.startDate() != null
						&& item.doneDate() != null)
				.sort(BY_DONE_DATE);
		if (eligible.isEmpty()) {
			throw ForecastException.missingVelocityData();
		}
		final List<WorkItem> recent = eligible.drop(Math.max(0, eligible.length() - HISTORY_SIZE));

		final var from = recent.map(WorkItem::startDate).minimum(DATE_ORD);
		final var to = recent.map(WorkItem::doneDate).maximum(DATE_ORD);
		final var capacity = calendar.summedCapacity(from, to);
		if (capacity <= 0) {
			throw ForecastException.invalidVelocityCapacity(from, to);
		}
		final var points = recent.foldLeft((sum, item) -> sum + item.storyPointValue().getAsDouble(), 0d);
		final var velocity = points / capacity;
		if (!(velocity > 0)) {
			throw ForecastException.invalidVelocityValue(velocity);
		}
		return velocity;
	}
}
