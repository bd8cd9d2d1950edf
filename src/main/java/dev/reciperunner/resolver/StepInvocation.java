package dev.reciperunner.resolver;

import dev.reciperunner.context.Context;

import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Everything a callable gets for one attempt of a step.
 */
public record StepInvocation(
    String stepName,
    int attempt,
    Map<String, Object> args,
    Context context,
    BooleanSupplier cancellation
) {
    /** True once the runner was asked to stop; the step may bail out early. */
    public boolean isCancellationRequested() {
        return cancellation.getAsBoolean();
    }

    /** Convenience accessor for a step argument. */
    public Object arg(String name, Object defaultValue) {
        return args.getOrDefault(name, defaultValue);
    }
}
