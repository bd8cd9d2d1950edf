package dev.reciperunner.resolver;

import dev.reciperunner.model.StepOutcome;

/**
 * The unit of work behind a step. Implementations may read and write the shared
 * context through the invocation; long-running ones should poll
 * {@link StepInvocation#isCancellationRequested()}.
 */
@FunctionalInterface
public interface StepCallable {

    /**
     * Run the step once.
     *
     * @return the outcome; throwing is treated as a failed attempt
     */
    StepOutcome call(StepInvocation invocation) throws Exception;
}
