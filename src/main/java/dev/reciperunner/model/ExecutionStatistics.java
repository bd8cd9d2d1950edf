package dev.reciperunner.model;

/**
 * Aggregate view over the runs a runner has retained in its history.
 */
public record ExecutionStatistics(
    long totalRuns,
    int retainedRuns,
    int successfulRuns,
    int failedRuns,
    int cancelledRuns,
    long totalStepsExecuted,
    double averageExecutionTimeSeconds,
    double successRate
) {
    public static ExecutionStatistics empty() {
        return new ExecutionStatistics(0, 0, 0, 0, 0, 0, 0.0, 0.0);
    }
}
