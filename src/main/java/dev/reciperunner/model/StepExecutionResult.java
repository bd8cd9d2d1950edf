package dev.reciperunner.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Terminal record of how one step fared in a run.
 *
 * @param stepName  step name
 * @param status    terminal status
 * @param attempts  number of attempts started, never more than the step's max attempts
 * @param startTime start of the first attempt, null if the step never ran
 * @param endTime   end of the last attempt, null if the step never ran
 * @param error     failure or skip reason, null on success
 * @param output    value reported by the callable on success
 */
public record StepExecutionResult(
    String stepName,
    StepStatus status,
    int attempts,
    Instant startTime,
    Instant endTime,
    String error,
    Object output
) {
    public double durationSeconds() {
        if (startTime == null || endTime == null) {
            return 0.0;
        }
        return Duration.between(startTime, endTime).toNanos() / 1_000_000_000.0;
    }
}
