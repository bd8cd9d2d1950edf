package dev.reciperunner.exception;

import dev.reciperunner.model.ValidationMessage;

import java.util.List;

/**
 * Raised by the runner when asked to execute a recipe that carries ERROR-level
 * validation messages. No step has run when this is thrown.
 */
public class InvalidRecipeException extends RecipeRunnerException {

    private final String recipeName;
    private final List<ValidationMessage> messages;

    public InvalidRecipeException(String recipeName, List<ValidationMessage> messages) {
        super("Recipe '%s' failed validation with %d error(s)".formatted(
            recipeName,
            messages.stream().filter(ValidationMessage::isError).count()));
        this.recipeName = recipeName;
        this.messages = List.copyOf(messages);
    }

    public String getRecipeName() {
        return recipeName;
    }

    public List<ValidationMessage> getMessages() {
        return messages;
    }
}
