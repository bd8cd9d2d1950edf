package dev.reciperunner.resolver;

import dev.reciperunner.context.Context;
import dev.reciperunner.exception.StepResolutionException;
import dev.reciperunner.model.StepOutcome;
import dev.reciperunner.resolver.fixtures.Echo;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReflectiveStepResolverTest {

    private static final String FIXTURES = "dev.reciperunner.resolver.fixtures";

    private final ReflectiveStepResolver resolver = new ReflectiveStepResolver();

    @Test
    void instantiatesStepClass() throws Exception {
        StepCallable callable = resolver.resolve(FIXTURES, "Echo");

        assertThat(callable).isInstanceOf(Echo.class);
        var context = new Context();
        var outcome = callable.call(new StepInvocation("greet", 1, Map.of("message", "hi"), context, () -> false));
        assertThat(outcome).isEqualTo(StepOutcome.success("hi"));
        assertThat(context.get("echo.greet")).isEqualTo("hi");
    }

    @Test
    void missingClassIsResolutionFailure() {
        assertThatThrownBy(() -> resolver.resolve(FIXTURES, "Missing"))
            .isInstanceOf(StepResolutionException.class)
            .hasMessageContaining("Class not found: " + FIXTURES + ".Missing");
    }

    @Test
    void rejectsClassThatIsNotAStep() {
        assertThatThrownBy(() -> resolver.resolve(FIXTURES, "NotAStep"))
            .isInstanceOf(StepResolutionException.class)
            .hasMessageContaining("does not implement StepCallable");
    }

    @Test
    void rejectsClassWithoutNoArgConstructor() {
        assertThatThrownBy(() -> resolver.resolve(FIXTURES, "NeedsArgument"))
            .isInstanceOf(StepResolutionException.class)
            .hasMessageContaining("no public no-arg constructor");
    }

    @Test
    void classFailingStaticInitIsResolutionFailureEveryTime() {
        // the first load throws ExceptionInInitializerError, later ones NoClassDefFoundError
        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> resolver.resolve(FIXTURES, "FailsToInitialize"))
                .isInstanceOf(StepResolutionException.class)
                .hasMessageContaining("Cannot load " + FIXTURES + ".FailsToInitialize")
                .hasCauseInstanceOf(LinkageError.class);
        }
    }

    @Test
    void rejectsBlankReferences() {
        assertThatThrownBy(() -> resolver.resolve(" ", "Echo"))
            .isInstanceOf(StepResolutionException.class);
    }
}
