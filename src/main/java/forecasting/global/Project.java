package forecasting.global;

import fj.data.List;

public record Project(String name, List<WorkItem> workPackages) {

	public boolean hasStoryPoints() {
		return workPackages.exists(item -> item.storyPointValue().isPresent());
	}
}
