package dev.reciperunner.resolver.fixtures;

import dev.reciperunner.model.StepOutcome;
import dev.reciperunner.resolver.StepCallable;
import dev.reciperunner.resolver.StepInvocation;

/** Returns its {@code message} argument and records it in the context. */
public class Echo implements StepCallable {

    @Override
    public StepOutcome call(StepInvocation invocation) {
        Object message = invocation.arg("message", "hello");
        invocation.context().set("echo." + invocation.stepName(), message, invocation.stepName());
        return StepOutcome.success(message);
    }
}
