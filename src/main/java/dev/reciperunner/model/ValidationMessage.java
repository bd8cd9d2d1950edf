package dev.reciperunner.model;

import java.util.Objects;

/**
 * A structured diagnostic produced while checking a recipe before execution.
 *
 * @param severity how serious the finding is
 * @param location where it was found, e.g. {@code recipe}, {@code steps[2].idx} or a step name
 * @param message  human-readable description
 * @param code     stable machine-readable code, e.g. {@code DUPLICATE_INDEX}
 */
public record ValidationMessage(
    Severity severity,
    String location,
    String message,
    String code
) {
    public ValidationMessage {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(message, "message");
    }

    public static ValidationMessage error(String location, String code, String message) {
        return new ValidationMessage(Severity.ERROR, location, message, code);
    }

    public static ValidationMessage warning(String location, String code, String message) {
        return new ValidationMessage(Severity.WARNING, location, message, code);
    }

    public static ValidationMessage info(String location, String code, String message) {
        return new ValidationMessage(Severity.INFO, location, message, code);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        String codePart = code == null ? "" : " [" + code + "]";
        return "%s%s at %s: %s".formatted(severity, codePart, location, message);
    }
}
