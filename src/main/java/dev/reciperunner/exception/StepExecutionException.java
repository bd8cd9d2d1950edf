package dev.reciperunner.exception;

/**
 * The callable behind a step threw or reported a failure. The underlying
 * throwable, if any, is kept as the cause.
 */
public class StepExecutionException extends RecipeRunnerException {

    private final String stepName;
    private final int attempt;

    public StepExecutionException(String stepName, int attempt, String message) {
        super(message);
        this.stepName = stepName;
        this.attempt = attempt;
    }

    public StepExecutionException(String stepName, int attempt, String message, Throwable cause) {
        super(message, cause);
        this.stepName = stepName;
        this.attempt = attempt;
    }

    public String getStepName() {
        return stepName;
    }

    public int getAttempt() {
        return attempt;
    }
}
