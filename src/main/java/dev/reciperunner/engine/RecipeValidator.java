package dev.reciperunner.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.reciperunner.exception.MalformedRecipeException;
import dev.reciperunner.exception.StepResolutionException;
import dev.reciperunner.model.RecipeMetadata;
import dev.reciperunner.model.RecipeSpec;
import dev.reciperunner.model.RetryPolicy;
import dev.reciperunner.model.Severity;
import dev.reciperunner.model.StepSpec;
import dev.reciperunner.model.ValidationMessage;
import dev.reciperunner.resolver.StepResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static dev.reciperunner.engine.RawValues.asInteger;
import static dev.reciperunner.engine.RawValues.asList;
import static dev.reciperunner.engine.RawValues.asMap;
import static dev.reciperunner.engine.RawValues.asNonBlankString;
import static dev.reciperunner.engine.RawValues.asNumber;
import static dev.reciperunner.engine.RawValues.stepLocation;
import static dev.reciperunner.engine.RawValues.steps;

/**
 * Turns a raw recipe mapping (as decoded from JSON or YAML) into a
 * {@link RecipeSpec}.
 *
 * <p>Validation is an ordered pipeline of independent checks. Checks never
 * short-circuit each other: a missing field does not hide a dependency cycle.
 * Problems surface as {@link ValidationMessage}s; only input that is not a mapping
 * at all, or whose {@code steps} is not a sequence, raises
 * {@link MalformedRecipeException}.
 *
 * <p>The execution plan is ordered by ascending {@code idx}. {@code depends_on}
 * is checked for dangling references and cycles but does not reorder steps.
 */
public final class RecipeValidator {

    private static final Logger logger = LoggerFactory.getLogger(RecipeValidator.class);

    private static final ObjectMapper CANONICAL = new ObjectMapper()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private static final String RECIPE = "recipe";

    private final Map<String, ValidationCheck> checks = new LinkedHashMap<>();

    public RecipeValidator() {
        this(null);
    }

    /**
     * @param resolver when non-null, step references are test-resolved and
     *                 failures reported as warnings
     */
    public RecipeValidator(StepResolver resolver) {
        checks.put("required_fields", RecipeValidator::checkRequiredFields);
        checks.put("step_structure", RecipeValidator::checkStepStructure);
        checks.put("unique_names", RecipeValidator::checkUniqueNames);
        checks.put("unique_indices", RecipeValidator::checkUniqueIndices);
        checks.put("dependency_references", RecipeValidator::checkDependencyReferences);
        checks.put("dependency_cycles", RecipeValidator::checkDependencyCycles);
        checks.put("dependency_order", RecipeValidator::checkDependencyOrder);
        if (resolver != null) {
            checks.put("callable_resolution", recipe -> checkResolvable(recipe, resolver));
        }
    }

    /**
     * Register an extra check. It runs after the built-in ones; registering an
     * existing name replaces that check in place.
     */
    public RecipeValidator addCheck(String name, ValidationCheck check) {
        checks.put(name, check);
        return this;
    }

    public Set<String> checkNames() {
        return Set.copyOf(checks.keySet());
    }

    public RecipeSpec validate(Object raw) throws MalformedRecipeException {
        return validate(raw, null);
    }

    /**
     * Validate a raw recipe and build its execution plan.
     *
     * @param raw        decoded recipe, expected to be a mapping
     * @param sourcePath where the recipe came from, recorded in the metadata
     * @return the plan and every message; check {@link RecipeSpec#isValid()}
     * @throws MalformedRecipeException if {@code raw} is not a mapping or
     *                                  {@code steps} is not a sequence
     */
    public RecipeSpec validate(Object raw, String sourcePath) throws MalformedRecipeException {
        Map<String, Object> recipe = asMap(raw);
        if (recipe == null) {
            throw new MalformedRecipeException("Recipe must be a mapping, got "
                + (raw == null ? "nothing" : raw.getClass().getSimpleName()));
        }
        if (recipe.get("steps") != null && asList(recipe.get("steps")) == null) {
            throw new MalformedRecipeException("Recipe 'steps' must be a sequence");
        }

        List<ValidationMessage> messages = new ArrayList<>();
        for (var entry : checks.entrySet()) {
            try {
                List<ValidationMessage> found = entry.getValue().check(recipe);
                messages.addAll(found);
                logger.debug("Check '{}' produced {} message(s)", entry.getKey(), found.size());
            } catch (RuntimeException e) {
                logger.warn("Check '{}' failed: {}", entry.getKey(), e.toString());
                messages.add(ValidationMessage.error("validator", "CHECK_FAILED",
                    "Check '%s' failed: %s".formatted(entry.getKey(), e.getMessage())));
            }
        }

        RecipeSpec spec = new RecipeSpec(buildMetadata(recipe, sourcePath), buildSteps(recipe), messages);
        logger.info("Validated recipe '{}': {} step(s), {} error(s), {} warning(s)",
            spec.name(), spec.steps().size(), spec.errors().size(), spec.warnings().size());
        return spec;
    }

    // --- checks -------------------------------------------------------------

    static List<ValidationMessage> checkRequiredFields(Map<String, Object> recipe) {
        var messages = new ArrayList<ValidationMessage>();
        if (!recipe.containsKey("name")) {
            messages.add(ValidationMessage.error(RECIPE, "MISSING_FIELD", "Required field 'name' is missing"));
        } else if (asNonBlankString(recipe.get("name")) == null) {
            messages.add(ValidationMessage.error(RECIPE, "INVALID_FIELD_VALUE",
                "Field 'name' must be a non-empty string"));
        }
        if (recipe.get("steps") == null) {
            messages.add(ValidationMessage.error(RECIPE, "MISSING_FIELD", "Required field 'steps' is missing"));
        } else if (steps(recipe).isEmpty()) {
            messages.add(ValidationMessage.warning(RECIPE, "EMPTY_STEPS", "Recipe contains no steps"));
        }
        return messages;
    }

    static List<ValidationMessage> checkStepStructure(Map<String, Object> recipe) {
        var messages = new ArrayList<ValidationMessage>();
        List<Object> steps = steps(recipe);
        for (int i = 0; i < steps.size(); i++) {
            String location = stepLocation(steps.get(i), i);
            Map<String, Object> step = asMap(steps.get(i));
            if (step == null) {
                messages.add(ValidationMessage.error(location, "INVALID_STEP_TYPE", "Step must be a mapping"));
                continue;
            }

            for (String field : List.of("name", "module", "function")) {
                if (!step.containsKey(field)) {
                    messages.add(ValidationMessage.error(location, "MISSING_STEP_FIELD",
                        "Step missing required field '%s'".formatted(field)));
                } else if (asNonBlankString(step.get(field)) == null) {
                    messages.add(ValidationMessage.error(location, "INVALID_FIELD_VALUE",
                        "Step field '%s' must be a non-empty string".formatted(field)));
                }
            }

            if (!step.containsKey("idx")) {
                messages.add(ValidationMessage.error(location, "MISSING_STEP_FIELD",
                    "Step missing required field 'idx'"));
            } else {
                Integer idx = asInteger(step.get("idx"));
                if (idx == null) {
                    messages.add(ValidationMessage.error(location, "INVALID_INDEX_TYPE",
                        "Step index must be an integer, got: " + describe(step.get("idx"))));
                } else if (idx < 0) {
                    messages.add(ValidationMessage.error(location, "NEGATIVE_INDEX",
                        "Step index must be non-negative, got: " + idx));
                }
            }

            if (step.get("args") != null && asMap(step.get("args")) == null) {
                messages.add(ValidationMessage.error(location, "INVALID_FIELD_VALUE",
                    "Step 'args' must be a mapping"));
            }

            Object dependsOn = step.get("depends_on");
            if (dependsOn != null) {
                List<Object> deps = asList(dependsOn);
                if (deps == null) {
                    messages.add(ValidationMessage.warning(location, "INVALID_DEPENDENCIES",
                        "Step 'depends_on' should be a list; it is ignored"));
                } else if (deps.stream().anyMatch(d -> asNonBlankString(d) == null)) {
                    messages.add(ValidationMessage.error(location, "INVALID_DEPENDENCIES",
                        "Step 'depends_on' entries must be non-empty strings"));
                }
            }

            messages.addAll(checkRetry(step, location));
            messages.addAll(checkTimeout(step, location));
        }
        return messages;
    }

    private static List<ValidationMessage> checkRetry(Map<String, Object> step, String location) {
        var messages = new ArrayList<ValidationMessage>();
        Object retry = step.get("retry");
        if (retry != null) {
            Map<String, Object> policy = asMap(retry);
            if (policy == null) {
                messages.add(ValidationMessage.error(location, "INVALID_RETRY", "Step 'retry' must be a mapping"));
                return messages;
            }
            if (policy.containsKey("max_attempts")) {
                Integer attempts = asInteger(policy.get("max_attempts"));
                if (attempts == null || attempts < 1) {
                    messages.add(ValidationMessage.error(location, "INVALID_RETRY",
                        "retry.max_attempts must be an integer >= 1, got: " + describe(policy.get("max_attempts"))));
                }
            }
            if (policy.containsKey("delay_seconds")) {
                Double delay = asNumber(policy.get("delay_seconds"));
                if (delay == null || delay < 0) {
                    messages.add(ValidationMessage.error(location, "INVALID_RETRY",
                        "retry.delay_seconds must be a number >= 0, got: " + describe(policy.get("delay_seconds"))));
                }
            }
        }
        if (step.containsKey("retry_count")) {
            Integer count = asInteger(step.get("retry_count"));
            if (count == null || count < 0 || count == Integer.MAX_VALUE) {
                messages.add(ValidationMessage.error(location, "INVALID_RETRY",
                    "retry_count must be an integer from 0 to %d, got: %s"
                        .formatted(Integer.MAX_VALUE - 1, describe(step.get("retry_count")))));
            } else if (retry != null) {
                messages.add(ValidationMessage.warning(location, "INVALID_RETRY",
                    "Both 'retry' and 'retry_count' are set; 'retry_count' is ignored"));
            }
        }
        return messages;
    }

    private static List<ValidationMessage> checkTimeout(Map<String, Object> step, String location) {
        for (String field : List.of("timeout_seconds", "timeout")) {
            if (step.get(field) != null) {
                Double seconds = asNumber(step.get(field));
                if (seconds == null || seconds <= 0) {
                    return List.of(ValidationMessage.error(location, "INVALID_TIMEOUT",
                        "Step '%s' must be a positive number, got: %s".formatted(field, describe(step.get(field)))));
                }
            }
        }
        return List.of();
    }

    static List<ValidationMessage> checkUniqueNames(Map<String, Object> recipe) {
        var messages = new ArrayList<ValidationMessage>();
        Set<String> seen = new LinkedHashSet<>();
        List<Object> steps = steps(recipe);
        for (int i = 0; i < steps.size(); i++) {
            Map<String, Object> step = asMap(steps.get(i));
            String name = step == null ? null : asNonBlankString(step.get("name"));
            if (name != null && !seen.add(name)) {
                messages.add(ValidationMessage.error("steps[" + i + "]", "DUPLICATE_STEP_NAME",
                    "Duplicate step name '%s'".formatted(name)));
            }
        }
        return messages;
    }

    static List<ValidationMessage> checkUniqueIndices(Map<String, Object> recipe) {
        Map<Integer, List<String>> byIndex = new TreeMap<>();
        List<Object> steps = steps(recipe);
        for (int i = 0; i < steps.size(); i++) {
            Map<String, Object> step = asMap(steps.get(i));
            Integer idx = step == null ? null : asInteger(step.get("idx"));
            if (idx != null) {
                byIndex.computeIfAbsent(idx, k -> new ArrayList<>()).add(stepLocation(step, i));
            }
        }

        var messages = new ArrayList<ValidationMessage>();
        byIndex.forEach((idx, names) -> {
            if (names.size() > 1) {
                String listed = names.stream().map(n -> "'" + n + "'").collect(Collectors.joining(", "));
                messages.add(ValidationMessage.error(RECIPE, "DUPLICATE_INDEX",
                    "Duplicate idx %d (steps: %s)".formatted(idx, listed)));
            }
        });
        return messages;
    }

    static List<ValidationMessage> checkDependencyReferences(Map<String, Object> recipe) {
        var messages = new ArrayList<ValidationMessage>();
        graphOf(recipe).missingDependencies().forEach((step, missing) -> {
            for (String dep : missing) {
                messages.add(ValidationMessage.error(step, "MISSING_DEPENDENCY",
                    "Step '%s' depends on non-existent step '%s'".formatted(step, dep)));
            }
        });
        return messages;
    }

    static List<ValidationMessage> checkDependencyCycles(Map<String, Object> recipe) {
        var messages = new ArrayList<ValidationMessage>();
        for (List<String> cycle : graphOf(recipe).findCycles()) {
            messages.add(ValidationMessage.error(cycle.get(0), "CIRCULAR_DEPENDENCY",
                "Circular dependency detected: " + String.join(" -> ", cycle)));
        }
        return messages;
    }

    /** Index order wins over depends_on, so a dependency with a later idx runs after its dependent. */
    static List<ValidationMessage> checkDependencyOrder(Map<String, Object> recipe) {
        Map<String, Integer> indices = new LinkedHashMap<>();
        Map<String, List<String>> deps = new LinkedHashMap<>();
        for (Object raw : steps(recipe)) {
            Map<String, Object> step = asMap(raw);
            String name = step == null ? null : asNonBlankString(step.get("name"));
            Integer idx = step == null ? null : asInteger(step.get("idx"));
            if (name != null && idx != null && !indices.containsKey(name)) {
                indices.put(name, idx);
                deps.put(name, dependencyNames(step));
            }
        }

        var messages = new ArrayList<ValidationMessage>();
        deps.forEach((name, dependsOn) -> {
            int idx = indices.get(name);
            for (String dep : dependsOn) {
                Integer depIdx = indices.get(dep);
                if (depIdx != null && depIdx > idx) {
                    messages.add(ValidationMessage.warning(name, "DEPENDENCY_ORDER",
                        "Step '%s' (idx %d) depends on '%s' (idx %d), which runs later in index order"
                            .formatted(name, idx, dep, depIdx)));
                }
            }
        });
        return messages;
    }

    static List<ValidationMessage> checkResolvable(Map<String, Object> recipe, StepResolver resolver) {
        var messages = new ArrayList<ValidationMessage>();
        List<Object> steps = steps(recipe);
        for (int i = 0; i < steps.size(); i++) {
            Map<String, Object> step = asMap(steps.get(i));
            if (step == null) {
                continue;
            }
            String module = asNonBlankString(step.get("module"));
            String function = asNonBlankString(step.get("function"));
            if (module == null || function == null) {
                continue;
            }
            try {
                resolver.resolve(module, function);
            } catch (StepResolutionException e) {
                messages.add(ValidationMessage.warning(stepLocation(step, i), "UNRESOLVED_CALLABLE",
                    "Cannot resolve '%s:%s' via %s resolver: %s"
                        .formatted(module, function, resolver.getName(), e.getMessage())));
            } catch (RuntimeException | LinkageError e) {
                logger.warn("Resolver {} crashed on '{}:{}': {}", resolver.getName(), module, function, e.toString());
                messages.add(ValidationMessage.warning(stepLocation(step, i), "UNRESOLVED_CALLABLE",
                    "Cannot resolve '%s:%s' via %s resolver: %s"
                        .formatted(module, function, resolver.getName(), e)));
            }
        }
        return messages;
    }

    // --- plan construction --------------------------------------------------

    private static DependencyGraph graphOf(Map<String, Object> recipe) {
        var graph = new DependencyGraph();
        for (Object raw : steps(recipe)) {
            Map<String, Object> step = asMap(raw);
            String name = step == null ? null : asNonBlankString(step.get("name"));
            if (name != null) {
                Integer idx = asInteger(step.get("idx"));
                graph.addStep(name, idx != null ? idx : Integer.MAX_VALUE, dependencyNames(step));
            }
        }
        return graph;
    }

    private static List<String> dependencyNames(Map<String, Object> step) {
        List<Object> deps = asList(step.get("depends_on"));
        if (deps == null) {
            return List.of();
        }
        return deps.stream().map(RawValues::asNonBlankString).filter(d -> d != null).toList();
    }

    private static RecipeMetadata buildMetadata(Map<String, Object> recipe, String sourcePath) {
        String name = asNonBlankString(recipe.get("name"));
        Object version = recipe.get("version");
        List<Object> tags = asList(recipe.get("tags"));
        return new RecipeMetadata(
            name != null ? name : "unnamed",
            version != null ? String.valueOf(version) : RecipeMetadata.DEFAULT_VERSION,
            recipe.get("description") instanceof String d ? d : "",
            recipe.get("author") instanceof String a ? a : "",
            tags == null ? List.of() : tags.stream().map(String::valueOf).toList(),
            contentHash(recipe),
            sourcePath
        );
    }

    /**
     * Steps usable for a plan: mappings with a non-blank name, a non-negative
     * integer idx, and a name not taken by an earlier step.
     */
    private static List<StepSpec> buildSteps(Map<String, Object> recipe) {
        var built = new ArrayList<StepSpec>();
        Set<String> names = new LinkedHashSet<>();
        for (Object raw : steps(recipe)) {
            Map<String, Object> step = asMap(raw);
            if (step == null) {
                continue;
            }
            String name = asNonBlankString(step.get("name"));
            Integer idx = asInteger(step.get("idx"));
            if (name == null || idx == null || idx < 0 || !names.add(name)) {
                continue;
            }
            Map<String, Object> args = asMap(step.get("args"));
            built.add(new StepSpec(
                name,
                idx,
                asNonBlankString(step.get("module")),
                asNonBlankString(step.get("function")),
                args != null ? args : Map.of(),
                new LinkedHashSet<>(dependencyNames(step)),
                retryPolicy(step),
                timeout(step),
                !Boolean.FALSE.equals(step.get("enabled"))
            ));
        }
        return built;
    }

    private static RetryPolicy retryPolicy(Map<String, Object> step) {
        Map<String, Object> retry = asMap(step.get("retry"));
        if (retry != null) {
            Integer attempts = retry.containsKey("max_attempts") ? asInteger(retry.get("max_attempts")) : Integer.valueOf(1);
            Double delay = retry.containsKey("delay_seconds") ? asNumber(retry.get("delay_seconds")) : Double.valueOf(0);
            if (attempts == null || attempts < 1 || delay == null || delay < 0) {
                return null;
            }
            return new RetryPolicy(attempts, RawValues.secondsToDuration(delay));
        }
        Integer retryCount = asInteger(step.get("retry_count"));
        if (retryCount != null && retryCount >= 0 && retryCount < Integer.MAX_VALUE) {
            return new RetryPolicy(retryCount + 1, Duration.ZERO);
        }
        return null;
    }

    private static Duration timeout(Map<String, Object> step) {
        Object raw = step.get("timeout_seconds") != null ? step.get("timeout_seconds") : step.get("timeout");
        Double seconds = asNumber(raw);
        return seconds != null && seconds > 0 ? RawValues.secondsToDuration(seconds) : null;
    }

    private static String contentHash(Map<String, Object> recipe) {
        try {
            byte[] canonical = CANONICAL.writeValueAsString(recipe).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(canonical));
        } catch (JsonProcessingException e) {
            logger.warn("Cannot hash recipe content: {}", e.getOriginalMessage());
            return null;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " " + value;
    }

    /** Human-readable summary of a validated recipe's messages. */
    public static String summarize(RecipeSpec spec) {
        var sb = new StringBuilder();
        sb.append("Recipe '").append(spec.name()).append("': ")
            .append(spec.isValid() ? "VALID" : "INVALID")
            .append(" (").append(spec.errors().size()).append(" error(s), ")
            .append(spec.warnings().size()).append(" warning(s), ")
            .append(spec.steps().size()).append(" step(s))");
        for (ValidationMessage message : spec.validationMessages()) {
            if (message.severity() != Severity.INFO) {
                sb.append(System.lineSeparator()).append("  ").append(message);
            }
        }
        return sb.toString();
    }
}
