package dev.reciperunner.engine;

import dev.reciperunner.model.RecipeExecutionResult;
import dev.reciperunner.model.RecipeSpec;
import dev.reciperunner.model.StepExecutionResult;
import dev.reciperunner.model.StepSpec;

/**
 * Receives run events, e.g. for metrics or analytics. Exceptions thrown here are
 * logged and never affect the run.
 */
public interface ExecutionListener {

    default void onRunStarted(RecipeSpec spec) {}

    default void onStepStarted(StepSpec step, int attempt) {}

    default void onStepFinished(StepExecutionResult result) {}

    default void onRunFinished(RecipeExecutionResult result) {}
}
