package io.modelvalidator.core.spi;

import io.modelvalidator.core.model.RuleSpec;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Input of a single {@link RuleEvaluator#evaluate} call.
 *
 * @param values plain field values; absent fields evaluate as {@code null}
 * @param rules the rule spec to enforce
 * @param customMessages already-translated custom messages keyed by {@code rule} or {@code
 *     rule.field}
 * @param attributeNames already-translated display names keyed by field
 * @param locale locale used for the evaluator's built-in messages
 */
public record EvaluationRequest(
        Map<String, Object> values,
        RuleSpec rules,
        Map<String, String> customMessages,
        Map<String, String> attributeNames,
        Locale locale) {

    public EvaluationRequest {
        Objects.requireNonNull(rules, "rules must not be null");
        Objects.requireNonNull(locale, "locale must not be null");
        values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
        customMessages = customMessages == null ? Map.of() : Map.copyOf(customMessages);
        attributeNames = attributeNames == null ? Map.of() : Map.copyOf(attributeNames);
    }

    /** Returns the value of the given field, or {@code null} when absent. */
    public Object value(String field) {
        return values.get(field);
    }
}
