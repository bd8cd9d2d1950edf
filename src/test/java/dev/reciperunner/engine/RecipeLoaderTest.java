package dev.reciperunner.engine;

import dev.reciperunner.exception.MalformedRecipeException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecipeLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @SuppressWarnings("unchecked")
    void loadsJsonRecipe() throws MalformedRecipeException {
        String json = """
            {
              "name": "nightly-export",
              "steps": [
                {"name": "fetch", "idx": 0, "module": "etl", "function": "Fetch"},
                {"name": "store", "idx": 1, "module": "etl", "function": "Store", "depends_on": ["fetch"]}
              ]
            }
            """;

        var raw = (Map<String, Object>) RecipeLoader.loadFromString(json, RecipeLoader.Format.JSON);

        assertThat(raw).containsEntry("name", "nightly-export");
        var steps = (List<Map<String, Object>>) raw.get("steps");
        assertThat(steps).hasSize(2);
        assertThat(steps.get(1)).containsEntry("depends_on", List.of("fetch"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void loadsYamlRecipe() throws MalformedRecipeException {
        String yaml = """
            name: nightly-export
            version: "2.1"
            steps:
              - name: fetch
                idx: 0
                module: etl
                function: Fetch
                retry:
                  max_attempts: 3
                  delay_seconds: 0.5
            """;

        var raw = (Map<String, Object>) RecipeLoader.loadFromString(yaml, RecipeLoader.Format.YAML);

        assertThat(raw).containsEntry("version", "2.1");
        var step = ((List<Map<String, Object>>) raw.get("steps")).get(0);
        assertThat(step.get("retry")).isEqualTo(Map.of("max_attempts", 3, "delay_seconds", 0.5));
    }

    @Test
    void rejectsUnparseableContent() {
        assertThatThrownBy(() -> RecipeLoader.loadFromString("{\"name\": ", RecipeLoader.Format.JSON))
            .isInstanceOf(MalformedRecipeException.class)
            .hasMessageContaining("Cannot parse JSON recipe");
    }

    @Test
    void picksFormatFromExtension() throws IOException, MalformedRecipeException {
        Path file = tempDir.resolve("recipe.yml");
        Files.writeString(file, "name: from-file\nsteps: []\n");

        assertThat(RecipeLoader.loadFromFile(file)).isEqualTo(Map.of("name", "from-file", "steps", List.of()));
        assertThat(RecipeLoader.Format.fromPath(Path.of("a.JSON"))).isEqualTo(RecipeLoader.Format.JSON);
    }

    @Test
    void rejectsUnknownExtension() {
        assertThatThrownBy(() -> RecipeLoader.Format.fromPath(Path.of("recipe.toml")))
            .isInstanceOf(MalformedRecipeException.class)
            .hasMessageContaining("Unsupported recipe format");
    }
}
