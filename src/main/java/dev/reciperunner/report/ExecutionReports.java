package dev.reciperunner.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.reciperunner.model.RecipeExecutionResult;
import dev.reciperunner.model.StepExecutionResult;
import dev.reciperunner.model.StepStatus;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON wire form of {@link RecipeExecutionResult}, plus a plain-text summary for
 * terminals. Field names are snake_case, timestamps ISO-8601.
 */
public final class ExecutionReports {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(SerializationFeature.INDENT_OUTPUT);

    private ExecutionReports() {}

    public static String toJson(RecipeExecutionResult result) throws JsonProcessingException {
        return MAPPER.writeValueAsString(result);
    }

    /** Derived fields in the input are ignored and recomputed from the step results. */
    public static RecipeExecutionResult fromJson(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, RecipeExecutionResult.class);
    }

    public static void export(RecipeExecutionResult result, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, toJson(result));
    }

    public static RecipeExecutionResult read(Path file) throws IOException {
        return fromJson(Files.readString(file));
    }

    public static String summarize(RecipeExecutionResult result) {
        var sb = new StringBuilder();
        sb.append("Recipe: ").append(result.recipeName()).append('\n');
        sb.append("Result: ").append(result.overallSuccess() ? "SUCCESS" : result.cancelled() ? "CANCELLED" : "FAILED");
        sb.append(" (%.3fs, success rate %.0f%%)".formatted(result.executionTimeSeconds(), result.successRate() * 100));
        sb.append('\n');

        for (StepExecutionResult step : result.stepResults()) {
            sb.append("  %-10s %s".formatted(step.status(), step.stepName()));
            if (step.attempts() > 1) {
                sb.append(" [").append(step.attempts()).append(" attempts]");
            }
            if (step.error() != null && step.status() != StepStatus.SUCCEEDED) {
                sb.append(": ").append(step.error());
            }
            sb.append('\n');
        }

        for (String error : result.globalErrors()) {
            sb.append("ERROR: ").append(error).append('\n');
        }
        for (String warning : result.globalWarnings()) {
            sb.append("WARNING: ").append(warning).append('\n');
        }
        return sb.toString();
    }
}
