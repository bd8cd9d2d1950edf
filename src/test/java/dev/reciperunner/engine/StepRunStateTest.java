package dev.reciperunner.engine;

import dev.reciperunner.model.StepStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StepRunStateTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant T1 = T0.plusSeconds(1);
    private static final Instant T2 = T0.plusSeconds(2);

    @Test
    void initializesAsPending() {
        var state = new StepRunState("fetch", 3);

        assertThat(state.stepName()).isEqualTo("fetch");
        assertThat(state.status()).isEqualTo(StepStatus.PENDING);
        assertThat(state.attempts()).isZero();
        assertThat(state.maxAttempts()).isEqualTo(3);
    }

    @Test
    void successAfterRetryKeepsFirstStartTime() {
        var state = new StepRunState("fetch", 3);

        state.startAttempt(T0);
        state.fail("boom", T1);
        assertThat(state.canRetry()).isTrue();
        state.startAttempt(T1);
        state.succeed("ok", T2);

        var result = state.toResult();
        assertThat(result.status()).isEqualTo(StepStatus.SUCCEEDED);
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(result.startTime()).isEqualTo(T0);
        assertThat(result.endTime()).isEqualTo(T2);
        assertThat(result.error()).isNull();
        assertThat(result.output()).isEqualTo("ok");
    }

    @Test
    void attemptsNeverExceedMaximum() {
        var state = new StepRunState("fetch", 2);

        state.startAttempt(T0);
        state.timeOut("slow", T1);
        state.startAttempt(T1);
        state.fail("boom", T2);

        assertThat(state.canRetry()).isFalse();
        assertThatThrownBy(() -> state.startAttempt(T2)).isInstanceOf(IllegalStateException.class);
        assertThat(state.toResult().status()).isEqualTo(StepStatus.FAILED);
        assertThat(state.toResult().attempts()).isEqualTo(2);
    }

    @Test
    void cancelWhileRetryPendingKeepsLastError() {
        var state = new StepRunState("fetch", 3);

        state.startAttempt(T0);
        state.fail("boom", T1);
        state.cancel("cancelled before retry", T2);

        var result = state.toResult();
        assertThat(result.status()).isEqualTo(StepStatus.CANCELLED);
        assertThat(result.error()).isEqualTo("cancelled before retry; last error: boom");
        assertThat(result.endTime()).isEqualTo(T2);
    }

    @Test
    void cannotCancelSucceededStep() {
        var state = new StepRunState("fetch", 1);
        state.startAttempt(T0);
        state.succeed(null, T1);

        assertThatThrownBy(() -> state.cancel("late", T2)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cancelBeforeStartHasNoTimes() {
        var state = new StepRunState("fetch", 2);
        state.cancel("cancelled before start", T0);

        var result = state.toResult();
        assertThat(result.status()).isEqualTo(StepStatus.CANCELLED);
        assertThat(result.error()).isEqualTo("cancelled before start");
        assertThat(result.attempts()).isZero();
        assertThat(result.startTime()).isNull();
        assertThat(result.endTime()).isNull();
    }

    @Test
    void skipOnlyFromPending() {
        var state = new StepRunState("fetch", 1);
        state.skip("excluded");

        assertThat(state.toResult().status()).isEqualTo(StepStatus.SKIPPED);
        assertThat(state.toResult().attempts()).isZero();
        assertThat(state.toResult().startTime()).isNull();
    }

    @Test
    void runningStateIsNotAResult() {
        var state = new StepRunState("fetch", 1);
        state.startAttempt(T0);

        assertThatThrownBy(state::toResult).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsNonPositiveMaxAttempts() {
        assertThatThrownBy(() -> new StepRunState("fetch", 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
