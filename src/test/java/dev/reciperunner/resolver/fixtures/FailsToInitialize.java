package dev.reciperunner.resolver.fixtures;

import dev.reciperunner.model.StepOutcome;
import dev.reciperunner.resolver.StepCallable;
import dev.reciperunner.resolver.StepInvocation;

public class FailsToInitialize implements StepCallable {

    private static final String ENDPOINT = lookupEndpoint();

    private static String lookupEndpoint() {
        throw new IllegalStateException("endpoint not configured");
    }

    @Override
    public StepOutcome call(StepInvocation invocation) {
        return StepOutcome.success(ENDPOINT);
    }
}
