package dev.reciperunner.context;

import java.io.IOException;
import java.util.Map;

/**
 * Opaque key/value store a {@link Context} can push its changed keys to.
 */
public interface ContextStore {

    /**
     * Persist a batch of changed keys. A null value means the key was removed.
     *
     * @param changes changed keys mapped to their current value
     */
    void flush(Map<String, Object> changes) throws IOException;
}
