package dev.reciperunner.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.reciperunner.model.RecipeExecutionResult;
import dev.reciperunner.model.StepExecutionResult;
import dev.reciperunner.model.StepStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionReportsTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path tempDir;

    @Test
    void roundTripPreservesOrderAndStatuses() throws JsonProcessingException {
        var original = sampleResult();

        var restored = ExecutionReports.fromJson(ExecutionReports.toJson(original));

        assertThat(restored).isEqualTo(original);
        assertThat(restored.stepResults()).extracting(StepExecutionResult::stepName)
            .containsExactly("fetch", "parse", "store");
        assertThat(restored.successRate()).isEqualTo(original.successRate());
    }

    @Test
    void writesSnakeCaseWithDerivedFields() throws JsonProcessingException {
        String json = ExecutionReports.toJson(sampleResult());

        assertThat(json)
            .contains("\"recipe_name\" : \"nightly\"")
            .contains("\"step_results\"")
            .contains("\"start_time\" : \"2024-05-01T10:00:00Z\"")
            .contains("\"status\" : \"TIMED_OUT\"")
            .contains("\"overall_success\" : false")
            .contains("\"success_rate\" : 0.5")
            .contains("\"execution_time_seconds\" : 5.0");
    }

    @Test
    void exportsToFile() throws IOException {
        Path file = tempDir.resolve("reports/run.json");

        ExecutionReports.export(sampleResult(), file);

        assertThat(file).exists();
        assertThat(ExecutionReports.read(file).recipeName()).isEqualTo("nightly");
    }

    @Test
    void summaryShowsStepsAndErrors() {
        String summary = ExecutionReports.summarize(sampleResult());

        assertThat(summary)
            .startsWith("Recipe: nightly\nResult: FAILED")
            .contains("SUCCEEDED  fetch [2 attempts]")
            .contains("TIMED_OUT  parse: Step 'parse' attempt 1 timed out after PT1S")
            .contains("SKIPPED    store: not started")
            .contains("ERROR: Step 'parse' timed out");
    }

    private static RecipeExecutionResult sampleResult() {
        return new RecipeExecutionResult(
            "nightly",
            List.of(
                new StepExecutionResult("fetch", StepStatus.SUCCEEDED, 2, START, START.plusSeconds(2), null,
                    Map.of("rows", 10)),
                new StepExecutionResult("parse", StepStatus.TIMED_OUT, 1, START.plusSeconds(2), START.plusSeconds(3),
                    "Step 'parse' attempt 1 timed out after PT1S", null),
                new StepExecutionResult("store", StepStatus.SKIPPED, 0, null, null, "not started", null)),
            List.of("Step 'parse' timed out after 1 attempt(s)"),
            List.of(),
            START,
            START.plusSeconds(5),
            false);
    }
}
