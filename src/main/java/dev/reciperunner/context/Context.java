package dev.reciperunner.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Shared key/value store read and written by steps and by the engine.
 *
 * <p>Every write is attributed to a {@code who} and appended to an audit history.
 * Reads of missing keys return the supplied default instead of failing. Keys are
 * not namespaced; by convention the engine writes under {@code recipe.*} and
 * {@code steps.<name>.*}. All operations are thread-safe.
 */
public final class Context {

    private static final Logger logger = LoggerFactory.getLogger(Context.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .enable(SerializationFeature.INDENT_OUTPUT);

    private final Map<String, Object> values = new HashMap<>();
    private final List<ChangeRecord> history = new ArrayList<>();
    private final Set<String> dirtyKeys = new LinkedHashSet<>();
    private final Clock clock;

    public Context() {
        this(Clock.systemUTC());
    }

    public Context(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Object get(String key) {
        return get(key, null);
    }

    public synchronized Object get(String key, Object defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    /**
     * Typed read. Returns the default when the key is missing or holds a value of
     * another type.
     */
    public synchronized <T> T get(String key, Class<T> type, T defaultValue) {
        Object value = values.get(key);
        return type.isInstance(value) ? type.cast(value) : defaultValue;
    }

    public synchronized boolean contains(String key) {
        return values.containsKey(key);
    }

    /**
     * Store a value. Writing a value equal to the current one changes nothing and
     * records no history.
     */
    public synchronized void set(String key, Object value, String who) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(who, "who");

        boolean existed = values.containsKey(key);
        Object previous = values.get(key);
        if (existed && Objects.equals(previous, value)) {
            logger.trace("No-op set for key '{}' by '{}'", key, who);
            return;
        }

        values.put(key, value);
        dirtyKeys.add(key);
        history.add(new ChangeRecord(key, previous, value, who, Instant.now(clock)));
        logger.debug("Set key '{}' by '{}'", key, who);
    }

    /** Remove a key; a no-op when it is absent. */
    public synchronized void remove(String key, String who) {
        Objects.requireNonNull(who, "who");
        if (!values.containsKey(key)) {
            return;
        }
        Object previous = values.remove(key);
        dirtyKeys.add(key);
        history.add(new ChangeRecord(key, previous, null, who, Instant.now(clock)));
        logger.debug("Removed key '{}' by '{}'", key, who);
    }

    public synchronized Set<String> keys() {
        return Set.copyOf(values.keySet());
    }

    public synchronized Map<String, Object> snapshot() {
        return new LinkedHashMap<>(values);
    }

    public synchronized List<ChangeRecord> history() {
        return List.copyOf(history);
    }

    /** Changes made to one key, oldest first. */
    public synchronized List<ChangeRecord> history(String key) {
        return history.stream().filter(r -> r.key().equals(key)).toList();
    }

    public synchronized int clearHistory() {
        int cleared = history.size();
        history.clear();
        return cleared;
    }

    /** Keys changed since the last call, in the order they were first changed. */
    public synchronized List<String> popDirtyKeys() {
        var keys = List.copyOf(dirtyKeys);
        dirtyKeys.clear();
        return keys;
    }

    /**
     * Hand every key changed since the last flush to the store. If the store
     * fails, the keys stay dirty and the exception propagates.
     */
    public void flushTo(ContextStore store) throws IOException {
        Map<String, Object> changes = new LinkedHashMap<>();
        List<String> flushed;
        synchronized (this) {
            flushed = popDirtyKeys();
            for (String key : flushed) {
                changes.put(key, values.get(key));
            }
        }
        if (changes.isEmpty()) {
            return;
        }
        try {
            store.flush(changes);
            logger.debug("Flushed {} context key(s)", changes.size());
        } catch (IOException | RuntimeException e) {
            synchronized (this) {
                dirtyKeys.addAll(flushed);
            }
            throw e;
        }
    }

    public String toJson() throws JsonProcessingException {
        return MAPPER.writeValueAsString(snapshot());
    }

    /**
     * Build a context from a JSON object. The loaded keys are not recorded in the
     * history.
     */
    public static Context fromJson(String json) throws JsonProcessingException {
        Map<String, Object> data = MAPPER.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        if (data == null) {
            throw new IllegalArgumentException("Context JSON must be an object");
        }
        var context = new Context();
        synchronized (context) {
            context.values.putAll(data);
        }
        return context;
    }

    @Override
    public synchronized String toString() {
        return "Context{keys=" + values.size() + ", history=" + history.size() + "}";
    }
}
