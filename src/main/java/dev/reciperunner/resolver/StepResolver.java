package dev.reciperunner.resolver;

import dev.reciperunner.exception.StepResolutionException;

/**
 * Turns a step's opaque module/function reference into something callable.
 */
public interface StepResolver {

    /**
     * @param moduleRef   module reference as declared by the step
     * @param functionRef function reference as declared by the step
     * @return a ready-to-call step implementation
     * @throws StepResolutionException if the reference cannot be resolved
     */
    StepCallable resolve(String moduleRef, String functionRef) throws StepResolutionException;

    /** Resolver display name, used in log lines. */
    String getName();
}
