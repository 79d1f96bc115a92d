package forecasting.yaml;

import forecasting.global.Estimate;
import forecasting.global.ForecastException;
import forecasting.global.Project;
import forecasting.global.Status;
import forecasting.global.WorkItem;
import lombok.RequiredArgsConstructor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import fj.data.List;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import static forecasting.yaml.YamlDocuments.*;

/**
 * Loads a {@link Project} from its YAML file.
 * <p>The {@code dependencies} of a work item follow a file convention: an empty list means the item depends on the previous item of the
 * file, while an absent or null entry means it depends on nothing. Reference estimates are resolved here, once, against the directory of
 * the project file when their path is relative.
 */
@Component
@RequiredArgsConstructor
public class ProjectYamlReader implements Function<Path, Project> {
	private static final Logger logger = LogManager.getLogger(ProjectYamlReader.class);

	private final SimulationReportYaml simulationReportYaml;

	@Override
	public Project apply(final Path projectFile) {
		final var project = toProject(load(projectFile), projectFile);
		logger.debug("loaded project {} with {} work items from {}", project.name(), project.workPackages().length(), projectFile);
		return project;
	}

	/**
	 * @param projectFile where the text comes from; relative reference paths are resolved against its directory.
	 */
	public Project parse(final String text, final Path projectFile) {
		return toProject(YamlDocuments.parse(text, projectFile), projectFile);
	}

	private Project toProject(final Object document, final Path projectFile) {
		final var root = asMap(document, projectFile, "project");
		final var name = requiredString(root, "name", projectFile);
		final var workItems = new ArrayList<WorkItem>();
		String previousId = null;
		for (var node : asList(root.get("work_packages"), projectFile, "work_packages")) {
			final var workItem = toWorkItem(asMap(node, projectFile, "work package"), previousId, projectFile);
			workItems.add(workItem);
			previousId = workItem.id();
		}
		return new Project(name, List.iterableList(workItems));
	}

	private WorkItem toWorkItem(final Map<String, Object> node, final String previousId, final Path projectFile) {
		final var id = optionalString(node, "id", projectFile)
				.filter(value -> !value.isBlank())
				.orElseThrow(ForecastException::missingItemId);
		return new WorkItem(
				id,
				optionalString(node, "summary", projectFile).orElse(null),
				optionalString(node, "description", projectFile).orElse(null),
				node.get("estimate") == null ? null : toEstimate(id, asMap(node.get("estimate"), projectFile, "estimate"), projectFile),
				dependenciesOf(id, node, previousId, projectFile),
				optionalString(node, "status", projectFile).map(Status::parse).orElse(null),
				optionalDate(node, "created_date", projectFile).orElse(null),
				optionalDate(node, "start_date", projectFile).orElse(null),
				optionalDate(node, "done_date", projectFile).orElse(null),
				optionalString(node, "subgraph", projectFile).orElse(null)
		);
	}

	private static List<String> dependenciesOf(
			final String id,
			final Map<String, Object> node,
			final String previousId,
			final Path projectFile
	) {
		final var value = node.get("dependencies");
		if (value == null) {
			return List.nil();
		}
		final var dependencies = asList(value, projectFile, "dependencies of " + id);
		if (dependencies.isEmpty()) {
			if (previousId == null) {
				throw ForecastException.missingPreviousDependency(id);
			}
			return List.single(previousId);
		}
		return List.iterableList(dependencies).map(String::valueOf);
	}

	private Estimate toEstimate(final String id, final Map<String, Object> node, final Path projectFile) {
		final var type = requiredString(node, "type", projectFile);
		switch (type) {
			case "story_points":
				return new Estimate.StoryPoints(requiredNumber(node, "value", projectFile));
			case "three_point":
				return new Estimate.ThreePoint(
						requiredNumber(node, "optimistic", projectFile),
						requiredNumber(node, "most_likely", projectFile),
						requiredNumber(node, "pessimistic", projectFile)
				);
			case "reference":
				return resolveReference(requiredString(node, "report_file_path", projectFile), projectFile);
			default:
				throw ForecastException.invalidYamlContent(projectFile, "unknown estimate type '" + type + "' of work item " + id);
		}
	}

	/** An unreadable report leaves the reference unresolved; the simulation refuses it later. */
	private Estimate.Reference resolveReference(final String reportFilePath, final Path projectFile) {
		final var reportFile = resolveAgainst(projectFile, reportFilePath);
		try {
			final var report = simulationReportYaml.read(reportFile);
			return new Estimate.Reference(reportFilePath, Optional.of(report.asThreePointEstimate()));
		} catch (ForecastException e) {
			logger.warn("reference estimate {} left unresolved: {}", reportFile, e.getMessage());
			return Estimate.Reference.unresolved(reportFilePath);
		}
	}

	/**
	 * A relative path is looked up in the working directory first and, when no such file exists there, next to the project file.
	 */
	static Path resolveAgainst(final Path projectFile, final String reportFilePath) {
		final var reportFile = Path.of(reportFilePath);
		if (reportFile.isAbsolute() || projectFile == null || Files.exists(reportFile)) {
			return reportFile;
		}
		final var directory = projectFile.toAbsolutePath().getParent();
		return directory == null ? reportFile : directory.resolve(reportFile);
	}
}
