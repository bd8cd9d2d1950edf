package dev.reciperunner.exception;

/**
 * Base type for every checked failure raised by the recipe engine.
 */
public class RecipeRunnerException extends Exception {

    public RecipeRunnerException(String message) {
        super(message);
    }

    public RecipeRunnerException(String message, Throwable cause) {
        super(message, cause);
    }
}
