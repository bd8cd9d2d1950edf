package dev.reciperunner.exception;

/**
 * Raised when raw recipe input cannot be interpreted at all: the root is not a
 * mapping, {@code steps} is not a sequence, or the file cannot be decoded.
 */
public class MalformedRecipeException extends RecipeRunnerException {

    public MalformedRecipeException(String message) {
        super(message);
    }

    public MalformedRecipeException(String message, Throwable cause) {
        super(message, cause);
    }
}
