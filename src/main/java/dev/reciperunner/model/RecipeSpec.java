package dev.reciperunner.model;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * A validated recipe: metadata, the execution plan ordered by ascending
 * {@code idx}, and every message the validator produced.
 */
public record RecipeSpec(
    RecipeMetadata metadata,
    List<StepSpec> steps,
    List<ValidationMessage> validationMessages
) {
    public RecipeSpec {
        steps = steps.stream().sorted(Comparator.comparingInt(StepSpec::idx)).toList();
        validationMessages = List.copyOf(validationMessages);
    }

    /** A recipe is only eligible for execution when no ERROR message exists. */
    public boolean isValid() {
        return validationMessages.stream().noneMatch(ValidationMessage::isError);
    }

    public String name() {
        return metadata.name();
    }

    public List<ValidationMessage> errors() {
        return bySeverity(Severity.ERROR);
    }

    public List<ValidationMessage> warnings() {
        return bySeverity(Severity.WARNING);
    }

    public Optional<StepSpec> step(String stepName) {
        return steps.stream().filter(s -> s.name().equals(stepName)).findFirst();
    }

    public List<String> stepNames() {
        return steps.stream().map(StepSpec::name).toList();
    }

    private List<ValidationMessage> bySeverity(Severity severity) {
        return validationMessages.stream().filter(m -> m.severity() == severity).toList();
    }
}
