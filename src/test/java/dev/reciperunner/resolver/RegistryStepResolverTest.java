package dev.reciperunner.resolver;

import dev.reciperunner.exception.StepResolutionException;
import dev.reciperunner.model.StepOutcome;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegistryStepResolverTest {

    @Test
    void resolvesRegisteredCallable() throws StepResolutionException {
        StepCallable callable = inv -> StepOutcome.success();
        var resolver = new RegistryStepResolver().register("etl", "fetch", callable);

        assertThat(resolver.isRegistered("etl", "fetch")).isTrue();
        assertThat(resolver.resolve("etl", "fetch")).isSameAs(callable);
        assertThat(resolver.getName()).isEqualTo("registry");
    }

    @Test
    void unknownReferenceFails() {
        var resolver = new RegistryStepResolver();

        assertThatThrownBy(() -> resolver.resolve("etl", "missing"))
            .isInstanceOf(StepResolutionException.class)
            .hasMessageContaining("No step registered for 'etl:missing'");
    }
}
