package dev.reciperunner.engine;

import dev.reciperunner.model.ValidationMessage;

import java.util.List;
import java.util.Map;

/**
 * One independent rule in the validation pipeline. A check inspects the raw
 * recipe mapping and reports zero or more messages; it must tolerate any partial
 * or malformed structure.
 */
@FunctionalInterface
public interface ValidationCheck {

    List<ValidationMessage> check(Map<String, Object> recipe);
}
