package dev.reciperunner.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import dev.reciperunner.exception.MalformedRecipeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Decodes recipe files into the raw mapping the validator consumes. The format
 * is picked from the file extension.
 */
public final class RecipeLoader {

    private static final Logger logger = LoggerFactory.getLogger(RecipeLoader.class);

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new YAMLMapper();

    /** Supported recipe encodings. */
    public enum Format {
        JSON,
        YAML;

        public static Format fromPath(Path path) throws MalformedRecipeException {
            String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
            if (fileName.endsWith(".json")) {
                return JSON;
            }
            if (fileName.endsWith(".yaml") || fileName.endsWith(".yml")) {
                return YAML;
            }
            throw new MalformedRecipeException(
                "Unsupported recipe format: " + path.getFileName() + ". Supported: .json, .yaml, .yml");
        }
    }

    private RecipeLoader() {}

    /**
     * Load a recipe file.
     *
     * @return the decoded document, normally a mapping
     * @throws IOException              if the file cannot be read
     * @throws MalformedRecipeException if the extension is unsupported or the content does not parse
     */
    public static Object loadFromFile(Path path) throws IOException, MalformedRecipeException {
        Format format = Format.fromPath(path);
        String content = Files.readString(path, StandardCharsets.UTF_8);
        logger.debug("Loading {} recipe from {} ({} chars)", format, path, content.length());
        return loadFromString(content, format);
    }

    /**
     * Decode recipe text in the given format.
     */
    public static Object loadFromString(String content, Format format) throws MalformedRecipeException {
        ObjectMapper mapper = format == Format.JSON ? JSON : YAML;
        try {
            return mapper.readValue(content, Object.class);
        } catch (JsonProcessingException e) {
            throw new MalformedRecipeException(
                "Cannot parse %s recipe: %s".formatted(format, e.getOriginalMessage()), e);
        }
    }
}
