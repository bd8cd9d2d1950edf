package dev.reciperunner.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionOptionsTest {

    private final StepSpec plain = StepSpec.of("fetch", 0, "etl", "Fetch");

    @Test
    void defaultsRunEverythingOnce() {
        var options = ExecutionOptions.defaults();

        assertThat(options.excludes("fetch")).isFalse();
        assertThat(options.continueOnError()).isFalse();
        assertThat(options.retryPolicyFor(plain)).isEqualTo(RetryPolicy.none());
        assertThat(options.timeoutFor(plain, null)).isNull();
    }

    @Test
    void skipWinsOverOnly() {
        var options = ExecutionOptions.builder().only(List.of("a", "b")).skip(List.of("b")).build();

        assertThat(options.excludes("a")).isFalse();
        assertThat(options.excludes("b")).isTrue();
        assertThat(options.excludes("c")).isTrue();
    }

    @Test
    void stepPolicyOverridesRunDefaults() {
        var options = ExecutionOptions.builder()
            .maxRetries(2)
            .retryDelay(Duration.ofMillis(10))
            .defaultTimeout(Duration.ofSeconds(5))
            .build();
        var declared = plain.withRetry(new RetryPolicy(4, Duration.ZERO)).withTimeout(Duration.ofSeconds(1));

        assertThat(options.retryPolicyFor(plain)).isEqualTo(new RetryPolicy(3, Duration.ofMillis(10)));
        assertThat(options.retryPolicyFor(declared).maxAttempts()).isEqualTo(4);
        assertThat(options.timeoutFor(plain, Duration.ofSeconds(30))).isEqualTo(Duration.ofSeconds(5));
        assertThat(options.timeoutFor(declared, Duration.ofSeconds(30))).isEqualTo(Duration.ofSeconds(1));
        assertThat(ExecutionOptions.defaults().timeoutFor(plain, Duration.ofSeconds(30))).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void rejectsNonsense() {
        assertThatThrownBy(() -> ExecutionOptions.builder().maxRetries(-1).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ExecutionOptions.builder().retryDelay(Duration.ofSeconds(-1)).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ExecutionOptions.builder().maxParallelSteps(0).build())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void largestRetryBudgetStillYieldsAPolicy() {
        assertThatThrownBy(() -> ExecutionOptions.builder().maxRetries(Integer.MAX_VALUE).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxRetries");

        var options = ExecutionOptions.builder().maxRetries(Integer.MAX_VALUE - 1).build();

        assertThat(options.retryPolicyFor(plain).maxAttempts()).isEqualTo(Integer.MAX_VALUE);
    }
}
