package dev.reciperunner.resolver;

import dev.reciperunner.exception.StepResolutionException;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves steps from callables registered in memory under
 * {@code module:function}.
 */
public final class RegistryStepResolver implements StepResolver {

    private final Map<String, StepCallable> registry = new ConcurrentHashMap<>();

    public RegistryStepResolver register(String moduleRef, String functionRef, StepCallable callable) {
        registry.put(key(moduleRef, functionRef), Objects.requireNonNull(callable, "callable"));
        return this;
    }

    public boolean isRegistered(String moduleRef, String functionRef) {
        return registry.containsKey(key(moduleRef, functionRef));
    }

    @Override
    public StepCallable resolve(String moduleRef, String functionRef) throws StepResolutionException {
        StepCallable callable = registry.get(key(moduleRef, functionRef));
        if (callable == null) {
            throw new StepResolutionException(moduleRef, functionRef,
                "No step registered for '%s:%s'".formatted(moduleRef, functionRef));
        }
        return callable;
    }

    @Override
    public String getName() {
        return "registry";
    }

    private static String key(String moduleRef, String functionRef) {
        return moduleRef + ":" + functionRef;
    }
}
