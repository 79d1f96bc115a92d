package forecasting.global;

import java.time.LocalDate;

/**
 * The number of issues a team completed on a given day.
 */
public record Throughput(LocalDate date, int completedIssues) {}
