package dev.reciperunner.model;

import java.util.List;

/**
 * Descriptive information about a recipe, plus a hash of its raw content for
 * change detection.
 */
public record RecipeMetadata(
    String name,
    String version,
    String description,
    String author,
    List<String> tags,
    String contentHash,
    String sourcePath // null for recipes built in memory
) {
    public static final String DEFAULT_VERSION = "1.0";

    public RecipeMetadata {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static RecipeMetadata named(String name) {
        return new RecipeMetadata(name, DEFAULT_VERSION, "", "", List.of(), null, null);
    }
}
