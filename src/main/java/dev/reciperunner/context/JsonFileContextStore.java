package dev.reciperunner.context;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Keeps the flushed context state in a single JSON file, rewritten on every flush.
 */
public final class JsonFileContextStore implements ContextStore {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileContextStore.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path file;
    private final Map<String, Object> state = new TreeMap<>();

    public JsonFileContextStore(Path file) throws IOException {
        this.file = file;
        if (Files.exists(file)) {
            state.putAll(MAPPER.readValue(file.toFile(), new TypeReference<LinkedHashMap<String, Object>>() {}));
        }
    }

    @Override
    public synchronized void flush(Map<String, Object> changes) throws IOException {
        for (var entry : changes.entrySet()) {
            if (entry.getValue() == null) {
                state.remove(entry.getKey());
            } else {
                state.put(entry.getKey(), entry.getValue());
            }
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        MAPPER.writeValue(tmp.toFile(), state);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.debug("Wrote {} key(s) to {}", state.size(), file);
    }

    public synchronized Map<String, Object> contents() {
        return new LinkedHashMap<>(state);
    }
}
