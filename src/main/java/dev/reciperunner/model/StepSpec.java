package dev.reciperunner.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A single validated unit of work within a recipe. Immutable.
 */
public record StepSpec(
    String name,
    int idx,
    String moduleRef,
    String functionRef,
    Map<String, Object> args,
    Set<String> dependsOn,
    RetryPolicy retry,   // nullable: the run-wide retry defaults apply
    Duration timeout,    // nullable: the run-wide timeout applies
    boolean enabled
) {
    public StepSpec {
        Objects.requireNonNull(name, "name");
        // args may legitimately hold null values, so no Map.copyOf here
        args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
        dependsOn = dependsOn == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn));
    }

    public static StepSpec of(String name, int idx, String moduleRef, String functionRef) {
        return new StepSpec(name, idx, moduleRef, functionRef, Map.of(), Set.of(), null, null, true);
    }

    public StepSpec withDependsOn(Set<String> dependencies) {
        return new StepSpec(name, idx, moduleRef, functionRef, args, dependencies, retry, timeout, enabled);
    }

    public StepSpec withRetry(RetryPolicy retryPolicy) {
        return new StepSpec(name, idx, moduleRef, functionRef, args, dependsOn, retryPolicy, timeout, enabled);
    }

    public StepSpec withTimeout(Duration stepTimeout) {
        return new StepSpec(name, idx, moduleRef, functionRef, args, dependsOn, retry, stepTimeout, enabled);
    }

    public StepSpec withEnabled(boolean stepEnabled) {
        return new StepSpec(name, idx, moduleRef, functionRef, args, dependsOn, retry, timeout, stepEnabled);
    }

    public StepSpec withArgs(Map<String, Object> stepArgs) {
        return new StepSpec(name, idx, moduleRef, functionRef, stepArgs, dependsOn, retry, timeout, enabled);
    }
}
