package dev.reciperunner.model;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Per-run execution policy: step filtering, failure handling, and the retry and
 * timeout defaults for steps that declare none.
 */
public record ExecutionOptions(
    Set<String> only,
    Set<String> skip,
    boolean continueOnError,
    Duration defaultTimeout, // null: fall back to the runner default
    int maxRetries,
    Duration retryDelay,
    boolean retryResolutionFailures,
    boolean dependencyParallel,
    int maxParallelSteps
) {
    public static final boolean DEFAULT_CONTINUE_ON_ERROR = false;
    public static final int DEFAULT_MAX_RETRIES = 0;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ZERO;
    public static final int DEFAULT_MAX_PARALLEL_STEPS = 4;

    public ExecutionOptions {
        only = only == null ? Set.of() : Set.copyOf(only);
        skip = skip == null ? Set.of() : Set.copyOf(skip);
        retryDelay = retryDelay == null ? DEFAULT_RETRY_DELAY : retryDelay;
        if (maxRetries < 0 || maxRetries == Integer.MAX_VALUE) {
            throw new IllegalArgumentException("maxRetries must be between 0 and %d, got %d"
                .formatted(Integer.MAX_VALUE - 1, maxRetries));
        }
        if (retryDelay.isNegative()) {
            throw new IllegalArgumentException("retryDelay must not be negative, got " + retryDelay);
        }
        if (maxParallelSteps < 1) {
            throw new IllegalArgumentException("maxParallelSteps must be >= 1, got " + maxParallelSteps);
        }
    }

    public static ExecutionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * True when filtering keeps this step from running. {@code skip} wins over
     * {@code only}.
     */
    public boolean excludes(String stepName) {
        if (skip.contains(stepName)) {
            return true;
        }
        return !only.isEmpty() && !only.contains(stepName);
    }

    /** The step's own retry policy, or one derived from {@code maxRetries} and {@code retryDelay}. */
    public RetryPolicy retryPolicyFor(StepSpec step) {
        if (step.retry() != null) {
            return step.retry();
        }
        return new RetryPolicy(maxRetries + 1, retryDelay);
    }

    /** Step timeout, then this run's default, then the runner's; null means unbounded. */
    public Duration timeoutFor(StepSpec step, Duration runnerDefault) {
        if (step.timeout() != null) {
            return step.timeout();
        }
        return defaultTimeout != null ? defaultTimeout : runnerDefault;
    }

    public static final class Builder {
        private final Set<String> only = new LinkedHashSet<>();
        private final Set<String> skip = new LinkedHashSet<>();
        private boolean continueOnError = DEFAULT_CONTINUE_ON_ERROR;
        private Duration defaultTimeout;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private boolean retryResolutionFailures;
        private boolean dependencyParallel;
        private int maxParallelSteps = DEFAULT_MAX_PARALLEL_STEPS;

        private Builder() {}

        public Builder only(Collection<String> stepNames) {
            only.addAll(stepNames);
            return this;
        }

        public Builder skip(Collection<String> stepNames) {
            skip.addAll(stepNames);
            return this;
        }

        public Builder continueOnError(boolean value) {
            this.continueOnError = value;
            return this;
        }

        public Builder defaultTimeout(Duration timeout) {
            this.defaultTimeout = timeout;
            return this;
        }

        public Builder maxRetries(int retries) {
            this.maxRetries = retries;
            return this;
        }

        public Builder retryDelay(Duration delay) {
            this.retryDelay = delay;
            return this;
        }

        public Builder retryResolutionFailures(boolean value) {
            this.retryResolutionFailures = value;
            return this;
        }

        public Builder dependencyParallel(boolean value) {
            this.dependencyParallel = value;
            return this;
        }

        public Builder maxParallelSteps(int value) {
            this.maxParallelSteps = value;
            return this;
        }

        public ExecutionOptions build() {
            return new ExecutionOptions(only, skip, continueOnError, defaultTimeout, maxRetries,
                retryDelay, retryResolutionFailures, dependencyParallel, maxParallelSteps);
        }
    }
}
