package dev.reciperunner.model;

/**
 * Severity of a validation message. Only {@link #ERROR} blocks execution.
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR
}
