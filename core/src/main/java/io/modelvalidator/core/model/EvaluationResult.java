package io.modelvalidator.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable outcome of one validation pass: an ordered list of error messages per failing field
 * plus the total error count. Fields without errors are absent from the map.
 *
 * <p>Thread-safe: all collections are unmodifiable copies.
 */
public final class EvaluationResult {

    private static final EvaluationResult EMPTY = new EvaluationResult(Map.of());

    private final Map<String, List<String>> errors;
    private final int errorCount;

    private EvaluationResult(Map<String, List<String>> errors) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        int count = 0;
        for (Map.Entry<String, List<String>> entry : errors.entrySet()) {
            List<String> messages = List.copyOf(entry.getValue());
            if (!messages.isEmpty()) {
                copy.put(entry.getKey(), messages);
                count += messages.size();
            }
        }
        this.errors = Collections.unmodifiableMap(copy);
        this.errorCount = count;
    }

    /**
     * Creates a result from the given per-field messages. Fields mapped to an empty list are dropped.
     * The map and its lists are defensively copied.
     */
    public static EvaluationResult of(Map<String, List<String>> errors) {
        Objects.requireNonNull(errors, "errors must not be null");
        return errors.isEmpty() ? EMPTY : new EvaluationResult(errors);
    }

    /** A result without any errors. */
    public static EvaluationResult valid() {
        return EMPTY;
    }

    /** Unmodifiable map of field to its ordered error messages. */
    public Map<String, List<String>> errors() {
        return errors;
    }

    /** Error messages for the field, or an empty list. */
    public List<String> get(String field) {
        return errors.getOrDefault(field, List.of());
    }

    /** The first error message for the field, or {@code null}. */
    public String first(String field) {
        List<String> messages = errors.get(field);
        return messages == null ? null : messages.get(0);
    }

    public boolean has(String field) {
        return errors.containsKey(field);
    }

    /** Fields carrying at least one error, in rule-spec order. */
    public Set<String> fieldsWithErrors() {
        return errors.keySet();
    }

    public int errorCount() {
        return errorCount;
    }

    public boolean isValid() {
        return errorCount == 0;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EvaluationResult other && errors.equals(other.errors);
    }

    @Override
    public int hashCode() {
        return errors.hashCode();
    }

    @Override
    public String toString() {
        return "EvaluationResult[errorCount=" + errorCount + ", errors=" + errors + "]";
    }
}
