package dev.reciperunner.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecipeExecutionResultTest {

    private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void successRateIgnoresSkippedAndCancelled() {
        var result = result(false,
            ran("a", StepStatus.SUCCEEDED),
            ran("b", StepStatus.TIMED_OUT),
            notRun("c", StepStatus.SKIPPED),
            notRun("d", StepStatus.CANCELLED));

        assertThat(result.successRate()).isEqualTo(0.5);
        assertThat(result.count(StepStatus.SKIPPED)).isEqualTo(1);
        assertThat(result.overallSuccess()).isFalse();
    }

    @Test
    void successRateIsZeroWhenNothingRan() {
        var result = result(false, notRun("a", StepStatus.SKIPPED));

        assertThat(result.successRate()).isZero();
        assertThat(result.overallSuccess()).isTrue();
    }

    @Test
    void cancelledRunIsNeverSuccessful() {
        var result = result(true, ran("a", StepStatus.SUCCEEDED));

        assertThat(result.overallSuccess()).isFalse();
    }

    @Test
    void executionTimeFromTimestamps() {
        var result = new RecipeExecutionResult("r", List.of(), List.of(), List.of(),
            START, START.plusMillis(1500), false);

        assertThat(result.executionTimeSeconds()).isEqualTo(1.5);
        assertThat(result.result("missing")).isNull();
    }

    private static StepExecutionResult ran(String name, StepStatus status) {
        return new StepExecutionResult(name, status, 1, START, START.plusSeconds(1), null, null);
    }

    private static StepExecutionResult notRun(String name, StepStatus status) {
        return new StepExecutionResult(name, status, 0, null, null, "not started", null);
    }

    private static RecipeExecutionResult result(boolean cancelled, StepExecutionResult... steps) {
        return new RecipeExecutionResult("r", List.of(steps), List.of(), List.of(), START, START.plusSeconds(2), cancelled);
    }
}
