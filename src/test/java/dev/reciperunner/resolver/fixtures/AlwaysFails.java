package dev.reciperunner.resolver.fixtures;

import dev.reciperunner.model.StepOutcome;
import dev.reciperunner.resolver.StepCallable;
import dev.reciperunner.resolver.StepInvocation;

public class AlwaysFails implements StepCallable {

    @Override
    public StepOutcome call(StepInvocation invocation) {
        return StepOutcome.failure("failed on attempt " + invocation.attempt());
    }
}
