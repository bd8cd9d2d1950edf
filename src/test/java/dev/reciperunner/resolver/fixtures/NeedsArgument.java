package dev.reciperunner.resolver.fixtures;

import dev.reciperunner.model.StepOutcome;
import dev.reciperunner.resolver.StepCallable;
import dev.reciperunner.resolver.StepInvocation;

public class NeedsArgument implements StepCallable {

    private final String value;

    public NeedsArgument(String value) {
        this.value = value;
    }

    @Override
    public StepOutcome call(StepInvocation invocation) {
        return StepOutcome.success(value);
    }
}
