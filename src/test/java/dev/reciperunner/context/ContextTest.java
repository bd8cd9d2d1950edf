package dev.reciperunner.context;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContextTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void missingKeyReturnsDefault() {
        var context = new Context();

        assertThat(context.get("absent")).isNull();
        assertThat(context.get("absent", "fallback")).isEqualTo("fallback");
        assertThat(context.contains("absent")).isFalse();
    }

    @Test
    void setRecordsAttributedHistory() {
        var context = new Context(Clock.fixed(NOW, ZoneOffset.UTC));

        context.set("count", 1, "step-a");
        context.set("count", 2, "step-b");

        assertThat(context.get("count")).isEqualTo(2);
        assertThat(context.history()).hasSize(2);
        var last = context.history().get(1);
        assertThat(last.key()).isEqualTo("count");
        assertThat(last.oldValue()).isEqualTo(1);
        assertThat(last.newValue()).isEqualTo(2);
        assertThat(last.who()).isEqualTo("step-b");
        assertThat(last.timestamp()).isEqualTo(NOW);
    }

    @Test
    void settingEqualValueIsNoOp() {
        var context = new Context();

        context.set("key", "value", "a");
        context.popDirtyKeys();
        context.set("key", "value", "b");

        assertThat(context.history()).hasSize(1);
        assertThat(context.popDirtyKeys()).isEmpty();
    }

    @Test
    void nullValueIsStoredAndRecorded() {
        var context = new Context();

        context.set("key", null, "a");

        assertThat(context.contains("key")).isTrue();
        assertThat(context.get("key", "fallback")).isNull();
        assertThat(context.history()).hasSize(1);
    }

    @Test
    void writerMustBeNamed() {
        var context = new Context();

        assertThatThrownBy(() -> context.set("key", 1, null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void typedGetFallsBackOnTypeMismatch() {
        var context = new Context();
        context.set("count", 3, "a");

        assertThat(context.get("count", Integer.class, 0)).isEqualTo(3);
        assertThat(context.get("count", String.class, "none")).isEqualTo("none");
    }

    @Test
    void removeRecordsNullNewValue() {
        var context = new Context();
        context.set("key", "v", "a");

        context.remove("key", "b");
        context.remove("key", "b");

        assertThat(context.contains("key")).isFalse();
        assertThat(context.history("key")).hasSize(2);
        assertThat(context.history("key").get(1).newValue()).isNull();
    }

    @Test
    void historyIsACopy() {
        var context = new Context();
        context.set("key", 1, "a");

        var history = context.history();
        context.set("key", 2, "a");

        assertThat(history).hasSize(1);
    }

    @Test
    void clearHistoryKeepsValues() {
        var context = new Context();
        context.set("a", 1, "x");
        context.set("b", 2, "x");

        assertThat(context.clearHistory()).isEqualTo(2);
        assertThat(context.history()).isEmpty();
        assertThat(context.snapshot()).containsEntry("a", 1).containsEntry("b", 2);
    }

    @Test
    void dirtyKeysArePoppedOnce() {
        var context = new Context();
        context.set("b", 1, "x");
        context.set("a", 1, "x");
        context.set("b", 2, "x");

        assertThat(context.popDirtyKeys()).containsExactly("b", "a");
        assertThat(context.popDirtyKeys()).isEmpty();
    }

    @Test
    void flushHandsDirtyKeysToStore() throws IOException {
        var context = new Context();
        var store = new RecordingStore();
        context.set("a", 1, "x");
        context.set("b", 2, "x");

        context.flushTo(store);
        context.flushTo(store);

        assertThat(store.flushes).hasSize(1);
        assertThat(store.flushes.get(0)).containsExactly(Map.entry("a", 1), Map.entry("b", 2));
    }

    @Test
    void failedFlushKeepsKeysDirty() {
        var context = new Context();
        context.set("a", 1, "x");

        assertThatThrownBy(() -> context.flushTo(changes -> { throw new IOException("disk full"); }))
            .isInstanceOf(IOException.class)
            .hasMessage("disk full");
        assertThat(context.popDirtyKeys()).containsExactly("a");
    }

    @Test
    void jsonRoundTripPreservesValues() throws IOException {
        var context = new Context();
        context.set("name", "demo", "x");
        context.set("count", 3, "x");
        context.set("nested", Map.of("ok", true), "x");

        var restored = Context.fromJson(context.toJson());

        assertThat(restored.snapshot()).isEqualTo(context.snapshot());
        assertThat(restored.history()).isEmpty();
    }

    private static final class RecordingStore implements ContextStore {
        final List<Map<String, Object>> flushes = new ArrayList<>();

        @Override
        public void flush(Map<String, Object> changes) {
            flushes.add(changes);
        }
    }
}
