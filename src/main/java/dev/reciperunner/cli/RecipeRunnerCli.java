package dev.reciperunner.cli;

import ch.qos.logback.classic.Level;
import dev.reciperunner.context.Context;
import dev.reciperunner.context.ContextStore;
import dev.reciperunner.context.JsonFileContextStore;
import dev.reciperunner.engine.ExecutionHistory;
import dev.reciperunner.engine.RecipeLoader;
import dev.reciperunner.engine.RecipeRunner;
import dev.reciperunner.engine.RecipeValidator;
import dev.reciperunner.exception.InvalidRecipeException;
import dev.reciperunner.exception.MalformedRecipeException;
import dev.reciperunner.model.ExecutionOptions;
import dev.reciperunner.model.RecipeExecutionResult;
import dev.reciperunner.model.RecipeSpec;
import dev.reciperunner.report.ExecutionReports;
import dev.reciperunner.resolver.ReflectiveStepResolver;
import dev.reciperunner.resolver.StepResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI entry point: load a recipe file, validate it and run it.
 *
 * <p>Exit codes: 0 when the run succeeds (or the recipe is valid with
 * {@code --validate-only}), 1 when the run fails or is cancelled, 2 when the
 * recipe cannot be loaded or does not validate.
 */
@Command(
    name = "recipe-runner",
    mixinStandardHelpOptions = true,
    description = "Validate and execute a declarative step recipe."
)
public class RecipeRunnerCli implements Callable<Integer> {

    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_EXECUTION_FAILED = 1;
    public static final int EXIT_INVALID_RECIPE = 2;

    private static final Logger logger = LoggerFactory.getLogger(RecipeRunnerCli.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Recipe file (.json, .yaml or .yml)")
    private Path recipeFile;

    @Option(names = "--debug", description = "Enable debug logging")
    private boolean debug;

    @Option(names = "--only", split = ",", paramLabel = "STEP", description = "Run only these steps")
    private List<String> only = new ArrayList<>();

    @Option(names = "--skip", split = ",", paramLabel = "STEP", description = "Skip these steps")
    private List<String> skip = new ArrayList<>();

    @Option(names = "--continue-on-error", description = "Keep running remaining steps after a failure")
    private boolean continueOnError;

    @Option(names = "--step-timeout", paramLabel = "SECONDS",
        description = "Timeout for steps that declare none (default: unbounded)")
    private Double stepTimeout;

    @Option(names = "--max-retries", paramLabel = "N", defaultValue = "0",
        description = "Extra attempts for steps that declare no retry policy (default: ${DEFAULT-VALUE})")
    private int maxRetries;

    @Option(names = "--retry-delay", paramLabel = "SECONDS", defaultValue = "0",
        description = "Delay between those attempts (default: ${DEFAULT-VALUE})")
    private double retryDelay;

    @Option(names = "--validate-only", description = "Validate the recipe and exit without running it")
    private boolean validateOnly;

    @Option(names = "--parallel", description = "Run independent steps concurrently, following depends_on")
    private boolean parallel;

    @Option(names = "--max-parallel", paramLabel = "N", defaultValue = "4",
        description = "Concurrent steps in --parallel mode (default: ${DEFAULT-VALUE})")
    private int maxParallel;

    @Option(names = "--report", paramLabel = "FILE", description = "Write the execution report as JSON")
    private Path reportFile;

    @Option(names = "--context-out", paramLabel = "FILE", description = "Persist context changes to a JSON file")
    private Path contextOut;

    private final StepResolver resolver;

    public RecipeRunnerCli() {
        this(new ReflectiveStepResolver());
    }

    public RecipeRunnerCli(StepResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public Integer call() {
        if (debug) {
            enableDebugLogging();
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ExecutionOptions options;
        try {
            options = options();
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_INVALID_RECIPE;
        }

        RecipeSpec recipe;
        try {
            Object raw = RecipeLoader.loadFromFile(recipeFile);
            recipe = new RecipeValidator(resolver).validate(raw, recipeFile.toString());
        } catch (MalformedRecipeException | IOException e) {
            err.println("Error: cannot load recipe " + recipeFile + ": " + e.getMessage());
            return EXIT_INVALID_RECIPE;
        }

        if (!recipe.isValid() || !recipe.warnings().isEmpty()) {
            (recipe.isValid() ? out : err).println(RecipeValidator.summarize(recipe));
        }
        if (!recipe.isValid()) {
            return EXIT_INVALID_RECIPE;
        }
        if (validateOnly) {
            out.println("Recipe '" + recipe.name() + "' is valid: " + String.join(", ", recipe.stepNames()));
            return EXIT_SUCCESS;
        }

        RecipeExecutionResult result;
        try (var runner = new RecipeRunner(resolver, null, ExecutionHistory.DEFAULT_LIMIT, contextStore(), Clock.systemUTC())) {
            Thread hook = new Thread(runner::cancel, "recipe-runner-cancel");
            Runtime.getRuntime().addShutdownHook(hook);
            try {
                result = runner.run(recipe, new Context(), options);
            } finally {
                removeShutdownHook(hook);
            }
        } catch (InvalidRecipeException e) {
            err.println(e.getMessage());
            return EXIT_INVALID_RECIPE;
        } catch (IOException e) {
            err.println("Error: cannot open context file " + contextOut + ": " + e.getMessage());
            return EXIT_INVALID_RECIPE;
        }

        out.print(ExecutionReports.summarize(result));
        if (reportFile != null) {
            try {
                ExecutionReports.export(result, reportFile);
                out.println("Report written to " + reportFile);
            } catch (IOException e) {
                err.println("Error: cannot write report " + reportFile + ": " + e.getMessage());
                return EXIT_EXECUTION_FAILED;
            }
        }
        return result.overallSuccess() ? EXIT_SUCCESS : EXIT_EXECUTION_FAILED;
    }

    ExecutionOptions options() {
        if (stepTimeout != null && stepTimeout <= 0) {
            throw new IllegalArgumentException("--step-timeout must be > 0, got " + stepTimeout);
        }
        return ExecutionOptions.builder()
            .only(only)
            .skip(skip)
            .continueOnError(continueOnError)
            .defaultTimeout(stepTimeout == null ? null : seconds(stepTimeout))
            .maxRetries(maxRetries)
            .retryDelay(seconds(retryDelay))
            .dependencyParallel(parallel)
            .maxParallelSteps(maxParallel)
            .build();
    }

    private ContextStore contextStore() throws IOException {
        return contextOut == null ? null : new JsonFileContextStore(contextOut);
    }

    private static Duration seconds(double value) {
        return Duration.ofNanos(Math.round(value * 1_000_000_000L));
    }

    private static void enableDebugLogging() {
        if (LoggerFactory.getLogger("dev.reciperunner") instanceof ch.qos.logback.classic.Logger root) {
            root.setLevel(Level.DEBUG);
        }
        logger.debug("Debug logging enabled");
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            logger.debug("JVM already shutting down, hook stays registered");
        }
    }
}
