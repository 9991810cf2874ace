package io.modelvalidator.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, ordered mapping of field name to rule expression, e.g. {@code age ->
 * "numeric|max:99"}. The grammar of the expression belongs to the configured {@link
 * io.modelvalidator.core.spi.RuleEvaluator}; this type never interprets it.
 */
public final class RuleSpec {

    private static final RuleSpec EMPTY = new RuleSpec(Map.of());

    private final Map<String, String> rules;

    private RuleSpec(Map<String, String> rules) {
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(rules));
    }

    /**
     * Creates a rule spec from the given map. Iteration order of the map becomes the evaluation
     * order of the fields. The map is defensively copied.
     *
     * @throws NullPointerException if the map, a field name or an expression is null
     */
    public static RuleSpec of(Map<String, String> rules) {
        Objects.requireNonNull(rules, "rules must not be null");
        rules.forEach((field, expression) -> {
            Objects.requireNonNull(field, "field name must not be null");
            Objects.requireNonNull(expression, () -> "rule expression for '" + field + "' must not be null");
        });
        return new RuleSpec(rules);
    }

    public static RuleSpec empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Returns the rule expression for the field, or {@code null} if the field has no rules. */
    public String rulesFor(String field) {
        return rules.get(field);
    }

    /** Field names in declaration order. */
    public Set<String> fields() {
        return rules.keySet();
    }

    /** Unmodifiable view of all rules. */
    public Map<String, String> asMap() {
        return rules;
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RuleSpec other && rules.equals(other.rules);
    }

    @Override
    public int hashCode() {
        return rules.hashCode();
    }

    @Override
    public String toString() {
        return "RuleSpec" + rules;
    }

    /** Builder preserving insertion order. */
    public static final class Builder {

        private final Map<String, String> rules = new LinkedHashMap<>();

        Builder() {}

        public Builder rule(String field, String expression) {
            rules.put(Objects.requireNonNull(field, "field"), Objects.requireNonNull(expression, "expression"));
            return this;
        }

        public RuleSpec build() {
            return new RuleSpec(rules);
        }
    }
}
