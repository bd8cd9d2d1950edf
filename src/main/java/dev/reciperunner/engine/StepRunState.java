package dev.reciperunner.engine;

import dev.reciperunner.model.StepExecutionResult;
import dev.reciperunner.model.StepStatus;

import java.time.Instant;

/**
 * Mutable state of one step while the runner works on it. Enforces the step
 * state machine and the attempt bound, then freezes into a
 * {@link StepExecutionResult}.
 */
public final class StepRunState {
    private final String stepName;
    private final int maxAttempts;
    private StepStatus status;
    private int attempts;
    private Instant startTime;
    private Instant endTime;
    private String error;
    private Object output;

    public StepRunState(String stepName, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        this.stepName = stepName;
        this.maxAttempts = maxAttempts;
        this.status = StepStatus.PENDING;
    }

    public String stepName() { return stepName; }
    public StepStatus status() { return status; }
    public int attempts() { return attempts; }
    public int maxAttempts() { return maxAttempts; }
    public String error() { return error; }

    /** PENDING, or a failed attempt with budget left, moves to RUNNING. */
    public void startAttempt(Instant now) {
        if (status != StepStatus.PENDING && !canRetry()) {
            throw new IllegalStateException("Step '%s' cannot start attempt %d from %s"
                .formatted(stepName, attempts + 1, status));
        }
        if (startTime == null) {
            startTime = now;
        }
        attempts++;
        status = StepStatus.RUNNING;
        error = null;
    }

    public void succeed(Object result, Instant now) {
        requireRunning();
        this.status = StepStatus.SUCCEEDED;
        this.output = result;
        this.endTime = now;
    }

    public void fail(String reason, Instant now) {
        requireRunning();
        this.status = StepStatus.FAILED;
        this.error = reason;
        this.endTime = now;
    }

    public void timeOut(String reason, Instant now) {
        requireRunning();
        this.status = StepStatus.TIMED_OUT;
        this.error = reason;
        this.endTime = now;
    }

    /** A failed or timed-out attempt may be retried while attempts remain. */
    public boolean canRetry() {
        return status.isFailure() && attempts < maxAttempts;
    }

    /** Cancel a step that has not started, or one whose retries are still pending. */
    public void cancel(String reason, Instant now) {
        if (status != StepStatus.PENDING && !status.isFailure()) {
            throw new IllegalStateException("Step '%s' cannot be cancelled from %s".formatted(stepName, status));
        }
        this.error = error == null ? reason : reason + "; last error: " + error;
        this.status = StepStatus.CANCELLED;
        if (startTime != null) {
            this.endTime = now;
        }
    }

    public void skip(String reason) {
        if (status != StepStatus.PENDING) {
            throw new IllegalStateException("Step '%s' cannot be skipped from %s".formatted(stepName, status));
        }
        this.status = StepStatus.SKIPPED;
        this.error = reason;
    }

    public StepExecutionResult toResult() {
        if (!status.isTerminal()) {
            throw new IllegalStateException("Step '%s' is still %s".formatted(stepName, status));
        }
        return new StepExecutionResult(stepName, status, attempts, startTime, endTime, error, output);
    }

    private void requireRunning() {
        if (status != StepStatus.RUNNING) {
            throw new IllegalStateException("Step '%s' is not running (%s)".formatted(stepName, status));
        }
    }
}
