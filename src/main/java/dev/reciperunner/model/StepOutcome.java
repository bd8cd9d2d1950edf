package dev.reciperunner.model;

/**
 * What a step callable reports back. Throwing from the callable is treated the
 * same as returning a {@link Failure}.
 */
public sealed interface StepOutcome {

    record Success(Object output) implements StepOutcome {}

    record Failure(String error) implements StepOutcome {}

    static StepOutcome success() {
        return new Success(null);
    }

    static StepOutcome success(Object output) {
        return new Success(output);
    }

    static StepOutcome failure(String error) {
        return new Failure(error);
    }
}
