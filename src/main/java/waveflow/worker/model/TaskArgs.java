package waveflow.worker.model;

import waveflow.worker.error.InvalidTaskArgumentsException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keyword arguments of a task invocation.
 * Producers mix snake_case and camelCase, so every lookup takes a list of aliases.
 */
public final class TaskArgs {

    private static final TaskArgs EMPTY = new TaskArgs(Map.of());

    private final Map<String, Object> values;

    private TaskArgs(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static TaskArgs of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new TaskArgs(new LinkedHashMap<>(values));
    }

    public static TaskArgs empty() {
        return EMPTY;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** First non-blank string value among the aliases. */
    public Optional<String> string(String... keys) {
        for (String key : keys) {
            Object value = values.get(key);
            if (value != null) {
                String s = String.valueOf(value);
                if (!s.isBlank()) {
                    return Optional.of(s);
                }
            }
        }
        return Optional.empty();
    }

    /** String value or null. */
    public String stringOrNull(String... keys) {
        return string(keys).orElse(null);
    }

    public String requireString(String... keys) throws InvalidTaskArgumentsException {
        return string(keys).orElseThrow(() -> new InvalidTaskArgumentsException(keys[0] + " is required"));
    }

    /**
     * Integer value among the aliases, or the fallback when absent.
     *
     * @throws InvalidTaskArgumentsException if present but not an integer, or outside the int range
     */
    public int intOr(int fallback, String... keys) throws InvalidTaskArgumentsException {
        for (String key : keys) {
            Object value = values.get(key);
            if (value instanceof Number n) {
                return exactInt(key, n);
            }
            if (value != null && !String.valueOf(value).isBlank()) {
                try {
                    return Integer.parseInt(String.valueOf(value).trim());
                } catch (NumberFormatException e) {
                    throw new InvalidTaskArgumentsException(key + " must be an integer, got '" + value + "'");
                }
            }
        }
        return fallback;
    }

    /**
     * Like {@link #intOr} but the value, once resolved, must lie in {@code [min, max]}.
     * The first alias names the argument in the error message.
     */
    public int intInRange(int fallback, int min, int max, String... keys) throws InvalidTaskArgumentsException {
        int value = intOr(fallback, keys);
        if (value < min || value > max) {
            throw new InvalidTaskArgumentsException(
                    keys[0] + " must be between " + min + " and " + max + ", got " + value);
        }
        return value;
    }

    private static int exactInt(String key, Number n) throws InvalidTaskArgumentsException {
        if (n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return n.intValue();
        }
        try {
            return new BigDecimal(n.toString()).intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new InvalidTaskArgumentsException(key + " must be an integer in int range, got " + n);
        }
    }

    /**
     * List of strings among the aliases; a single string is treated as a one-element list.
     */
    public List<String> stringList(String... keys) {
        for (String key : keys) {
            Object value = values.get(key);
            if (value instanceof List<?> list) {
                List<String> result = new ArrayList<>(list.size());
                for (Object item : list) {
                    if (item != null && !String.valueOf(item).isBlank()) {
                        result.add(String.valueOf(item));
                    }
                }
                return result;
            }
            if (value instanceof String s && !s.isBlank()) {
                return List.of(s);
            }
        }
        return List.of();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskArgs other))
            return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
