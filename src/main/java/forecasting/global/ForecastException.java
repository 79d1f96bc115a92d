package forecasting.global;

import lombok.Getter;

import java.nio.file.Path;
import java.time.LocalDate;

/**
 * The single failure type of the forecasting engine. Failures are never retried: they abort the run and no partial report is produced.
 * <p>The {@link Kind} tells the caller which category of problem was detected. Instances are created through the named factory methods so
 * that the messages stay uniform.
 */
@Getter
public class ForecastException extends RuntimeException {

	public enum Kind {
		/** Missing or duplicated ids, unknown or cyclic dependencies. */
		STRUCTURAL,
		/** Missing, inconsistent or unresolved estimates. */
		ESTIMATION,
		/** Velocity that cannot be derived or is required but absent. */
		VELOCITY,
		/** Unreadable or invalid input files and values. */
		INPUT,
		/** Invalid run parameters. */
		CONFIGURATION
	}

	private final Kind kind;

	public ForecastException(final Kind kind, final String message) {
		super(message);
		this.kind = kind;
	}

	public ForecastException(final Kind kind, final String message, final Throwable cause) {
		super(message, cause);
		this.kind = kind;
	}

	// structural

	public static ForecastException missingItemId() {
		return new ForecastException(Kind.STRUCTURAL, "missing work item id");
	}

	public static ForecastException duplicateItemId(final String id) {
		return new ForecastException(Kind.STRUCTURAL, "duplicate work item id " + id);
	}

	public static ForecastException unknownDependency(final String item, final String dependency) {
		return new ForecastException(Kind.STRUCTURAL, "dependency " + dependency + " not found for work item " + item);
	}

	public static ForecastException cyclicDependencies() {
		return new ForecastException(Kind.STRUCTURAL, "dependency graph has a cycle");
	}

	public static ForecastException missingPreviousDependency(final String item) {
		return new ForecastException(Kind.STRUCTURAL, "work item " + item + " declares an implicit dependency but has no previous item");
	}

	// estimation

	public static ForecastException missingEstimate(final String item) {
		return new ForecastException(Kind.ESTIMATION, "missing estimate for work item " + item);
	}

	public static ForecastException invalidEstimate(final String item, final String detail) {
		return new ForecastException(Kind.ESTIMATION, "invalid estimate values for work item " + item + ": " + detail);
	}

	public static ForecastException invalidTriplet(final double optimistic, final double mostLikely, final double pessimistic) {
		return new ForecastException(
				Kind.ESTIMATION,
				"inconsistent three-point estimate (" + optimistic + ", " + mostLikely + ", " + pessimistic + ")"
		);
	}

	public static ForecastException unresolvedReference(final String item, final String reportPath) {
		return new ForecastException(Kind.ESTIMATION, "reference estimate of work item " + item + " could not be resolved from " + reportPath);
	}

	// velocity

	public static ForecastException missingVelocityData() {
		return new ForecastException(Kind.VELOCITY, "no completed work items with story point estimates and start/done dates");
	}

	public static ForecastException invalidVelocityCapacity(final LocalDate from, final LocalDate to) {
		return new ForecastException(Kind.VELOCITY, "the team calendar offers no capacity between " + from + " and " + to);
	}

	public static ForecastException invalidVelocityValue(final double velocity) {
		return new ForecastException(Kind.VELOCITY, "invalid velocity value " + velocity);
	}

	public static ForecastException missingVelocity(final String item) {
		return new ForecastException(Kind.VELOCITY, "missing velocity for the story point estimate of work item " + item);
	}

	// input

	public static ForecastException unreadableFile(final Path path, final Throwable cause) {
		return new ForecastException(Kind.INPUT, "failed to read " + path + ": " + cause.getMessage(), cause);
	}

	public static ForecastException unwritableFile(final Path path, final Throwable cause) {
		return new ForecastException(Kind.INPUT, "failed to write " + path + ": " + cause.getMessage(), cause);
	}

	public static ForecastException unparseableYaml(final Path path, final Throwable cause) {
		return new ForecastException(Kind.INPUT, "failed to parse yaml " + path + ": " + cause.getMessage(), cause);
	}

	public static ForecastException invalidYamlContent(final Path path, final String detail) {
		return new ForecastException(Kind.INPUT, "invalid content in " + path + ": " + detail);
	}

	public static ForecastException invalidDate(final String value) {
		return new ForecastException(Kind.INPUT, "invalid date format: " + value + " (expected YYYY-MM-DD)");
	}

	public static ForecastException invalidStatus(final String value) {
		return new ForecastException(Kind.INPUT, "invalid status value: " + value);
	}

	public static ForecastException invalidWeekday(final Path path, final String value) {
		return new ForecastException(Kind.INPUT, "invalid weekday value in " + path + ": " + value);
	}

	public static ForecastException invalidDateRange(final LocalDate start, final LocalDate end) {
		return new ForecastException(Kind.INPUT, "invalid date range: start_date " + start + " is after end_date " + end);
	}

	public static ForecastException calendarDirectoryNotFound(final Path path) {
		return new ForecastException(Kind.INPUT, "calendar directory not found: " + path);
	}

	public static ForecastException calendarDirectoryEmpty(final Path path) {
		return new ForecastException(Kind.INPUT, "calendar directory contains no yaml files: " + path);
	}

	// configuration

	public static ForecastException invalidIterations() {
		return new ForecastException(Kind.CONFIGURATION, "iterations must be greater than zero");
	}

	public static ForecastException invalidIssueCount() {
		return new ForecastException(Kind.CONFIGURATION, "number of issues must be greater than zero");
	}

	public static ForecastException invalidWorkers() {
		return new ForecastException(Kind.CONFIGURATION, "workers must be greater than zero");
	}

	public static ForecastException emptyProject() {
		return new ForecastException(Kind.CONFIGURATION, "project has no work packages");
	}

	public static ForecastException emptyThroughput() {
		return new ForecastException(Kind.CONFIGURATION, "throughput data is empty");
	}

	public static ForecastException zeroThroughput() {
		return new ForecastException(Kind.CONFIGURATION, "throughput data has no nonzero values");
	}

	public static ForecastException calendarWithoutCapacity(final LocalDate from) {
		return new ForecastException(Kind.CONFIGURATION, "the team calendar offers no capacity in the century following " + from);
	}
}
