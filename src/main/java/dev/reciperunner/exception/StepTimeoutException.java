package dev.reciperunner.exception;

import java.time.Duration;

/**
 * One attempt of a step exceeded its time bound and was abandoned.
 */
public class StepTimeoutException extends RecipeRunnerException {

    private final String stepName;
    private final int attempt;
    private final Duration timeout;

    public StepTimeoutException(String stepName, int attempt, Duration timeout) {
        super("Step '%s' attempt %d timed out after %s".formatted(stepName, attempt, timeout));
        this.stepName = stepName;
        this.attempt = attempt;
        this.timeout = timeout;
    }

    public String getStepName() {
        return stepName;
    }

    public int getAttempt() {
        return attempt;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
