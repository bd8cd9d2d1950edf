package dev.reciperunner.resolver;

import dev.reciperunner.exception.StepResolutionException;

import java.lang.reflect.InvocationTargetException;

/**
 * Loads step implementations by class name: {@code module} is a package,
 * {@code function} the simple name of a class implementing {@link StepCallable}
 * with a public no-arg constructor. A fresh instance is created per resolution.
 */
public final class ReflectiveStepResolver implements StepResolver {

    private final ClassLoader classLoader;

    public ReflectiveStepResolver() {
        this(Thread.currentThread().getContextClassLoader());
    }

    public ReflectiveStepResolver(ClassLoader classLoader) {
        this.classLoader = classLoader != null ? classLoader : ReflectiveStepResolver.class.getClassLoader();
    }

    @Override
    public StepCallable resolve(String moduleRef, String functionRef) throws StepResolutionException {
        if (moduleRef == null || moduleRef.isBlank() || functionRef == null || functionRef.isBlank()) {
            throw new StepResolutionException(moduleRef, functionRef, "Module and function must both be set");
        }
        String className = moduleRef + "." + functionRef;

        Class<?> type;
        try {
            type = Class.forName(className, true, classLoader);
        } catch (ClassNotFoundException e) {
            throw new StepResolutionException(moduleRef, functionRef, "Class not found: " + className, e);
        } catch (LinkageError e) {
            // static initializer failure, or a class that failed to initialize earlier
            Throwable cause = e instanceof ExceptionInInitializerError init && init.getCause() != null
                ? init.getCause()
                : e;
            throw new StepResolutionException(moduleRef, functionRef,
                "Cannot load " + className + ": " + cause, e);
        }

        if (!StepCallable.class.isAssignableFrom(type)) {
            throw new StepResolutionException(moduleRef, functionRef,
                "%s does not implement %s".formatted(className, StepCallable.class.getSimpleName()));
        }

        try {
            return (StepCallable) type.getDeclaredConstructor().newInstance();
        } catch (NoSuchMethodException e) {
            throw new StepResolutionException(moduleRef, functionRef,
                className + " has no public no-arg constructor", e);
        } catch (InvocationTargetException e) {
            throw new StepResolutionException(moduleRef, functionRef,
                "Constructor of " + className + " failed: " + e.getCause(), e.getCause());
        } catch (ReflectiveOperationException | RuntimeException e) {
            throw new StepResolutionException(moduleRef, functionRef,
                "Cannot instantiate " + className + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String getName() {
        return "reflective";
    }
}
