package dev.reciperunner.engine;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lenient accessors over decoded JSON/YAML values.
 */
final class RawValues {

    private RawValues() {}

    static String asNonBlankString(Object value) {
        return value instanceof String s && !s.isBlank() ? s : null;
    }

    /** Integral numbers within int range; anything else, including booleans and 1.5, is null. */
    static Integer asInteger(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        if (value instanceof Long l && l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
            return l.intValue();
        }
        if (value instanceof BigInteger big && big.bitLength() < 32) {
            return big.intValue();
        }
        return null;
    }

    /** Numeric value, or null for non-numbers and NaN. */
    static Double asNumber(Object value) {
        if (!(value instanceof Number n) || Double.isNaN(n.doubleValue())) {
            return null;
        }
        return n.doubleValue();
    }

    static Duration secondsToDuration(double seconds) {
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000L));
    }

    static Map<String, Object> asMap(Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }

    static List<Object> asList(Object value) {
        return value instanceof List<?> list ? new ArrayList<>(list) : null;
    }

    /** The {@code steps} sequence, or an empty list when absent or not a list. */
    static List<Object> steps(Map<String, Object> recipe) {
        List<Object> steps = asList(recipe.get("steps"));
        return steps == null ? List.of() : steps;
    }

    /** Where to point a message about the step at {@code position}. */
    static String stepLocation(Object step, int position) {
        Map<String, Object> map = asMap(step);
        String name = map == null ? null : asNonBlankString(map.get("name"));
        return name != null ? name : "steps[" + position + "]";
    }
}
