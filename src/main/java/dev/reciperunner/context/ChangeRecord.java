package dev.reciperunner.context;

import java.time.Instant;

/**
 * One attributed mutation of the context. {@code newValue} is null for removals,
 * {@code oldValue} is null when the key did not exist.
 */
public record ChangeRecord(
    String key,
    Object oldValue,
    Object newValue,
    String who,
    Instant timestamp
) {}
