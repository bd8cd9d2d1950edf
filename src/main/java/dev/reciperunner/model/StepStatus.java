package dev.reciperunner.model;

/**
 * Lifecycle of a step within one run.
 * <pre>
 * PENDING -> RUNNING -> SUCCEEDED | FAILED | TIMED_OUT | CANCELLED
 * FAILED | TIMED_OUT -> RUNNING   (retry)
 * PENDING -> SKIPPED | CANCELLED
 * </pre>
 */
public enum StepStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED,
    TIMED_OUT,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    /** FAILED and TIMED_OUT both count against overall success. */
    public boolean isFailure() {
        return this == FAILED || this == TIMED_OUT;
    }
}
