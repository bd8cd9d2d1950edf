package dev.reciperunner.exception;

/**
 * A step's module/function reference could not be turned into a callable.
 */
public class StepResolutionException extends RecipeRunnerException {

    private final String moduleRef;
    private final String functionRef;

    public StepResolutionException(String moduleRef, String functionRef, String message) {
        super(message);
        this.moduleRef = moduleRef;
        this.functionRef = functionRef;
    }

    public StepResolutionException(String moduleRef, String functionRef, String message, Throwable cause) {
        super(message, cause);
        this.moduleRef = moduleRef;
        this.functionRef = functionRef;
    }

    public String getModuleRef() {
        return moduleRef;
    }

    public String getFunctionRef() {
        return functionRef;
    }
}
