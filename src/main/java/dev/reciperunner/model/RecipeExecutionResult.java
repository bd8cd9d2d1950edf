package dev.reciperunner.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Complete, serializable outcome of one recipe run. Produced by the runner only.
 */
public record RecipeExecutionResult(
    String recipeName,
    List<StepExecutionResult> stepResults,
    List<String> globalErrors,
    List<String> globalWarnings,
    Instant startTime,
    Instant endTime,
    boolean cancelled
) {
    public RecipeExecutionResult {
        stepResults = List.copyOf(stepResults);
        globalErrors = List.copyOf(globalErrors);
        globalWarnings = List.copyOf(globalWarnings);
    }

    @JsonProperty("execution_time_seconds")
    public double executionTimeSeconds() {
        return Duration.between(startTime, endTime).toNanos() / 1_000_000_000.0;
    }

    /** succeeded / (succeeded + failed + timed out); 0.0 when no step ran to an outcome. */
    @JsonProperty("success_rate")
    public double successRate() {
        long succeeded = count(StepStatus.SUCCEEDED);
        long failed = count(StepStatus.FAILED) + count(StepStatus.TIMED_OUT);
        if (succeeded + failed == 0) {
            return 0.0;
        }
        return (double) succeeded / (succeeded + failed);
    }

    @JsonProperty("overall_success")
    public boolean overallSuccess() {
        return !cancelled
            && globalErrors.isEmpty()
            && stepResults.stream().noneMatch(r -> r.status().isFailure());
    }

    public long count(StepStatus status) {
        return stepResults.stream().filter(r -> r.status() == status).count();
    }

    public StepExecutionResult result(String stepName) {
        return stepResults.stream()
            .filter(r -> r.stepName().equals(stepName))
            .findFirst()
            .orElse(null);
    }
}
