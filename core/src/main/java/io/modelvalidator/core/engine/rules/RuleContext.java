package io.modelvalidator.core.engine.rules;

import io.modelvalidator.core.spi.EvaluationRequest;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Everything a built-in rule needs to judge one field value. */
final class RuleContext {

    private final String field;
    private final Object value;
    private final ParsedRule rule;
    private final List<ParsedRule> fieldRules;
    private final EvaluationRequest request;

    RuleContext(String field, Object value, ParsedRule rule, List<ParsedRule> fieldRules, EvaluationRequest request) {
        this.field = field;
        this.value = value;
        this.rule = rule;
        this.fieldRules = fieldRules;
        this.request = request;
    }

    String field() {
        return field;
    }

    Object value() {
        return value;
    }

    List<String> params() {
        return rule.params();
    }

    String param(int index) {
        return rule.param(index);
    }

    BigDecimal numberParam(int index) {
        return new BigDecimal(rule.param(index));
    }

    /** Value of another field, resolving dotted paths into nested maps. */
    Object valueOf(String otherField) {
        return lookup(request.values(), otherField);
    }

    /** Display name of a field: configured attribute name, or the field name with underscores as spaces. */
    String displayName(String anyField) {
        String configured = request.attributeNames().get(anyField);
        return configured != null ? configured : anyField.replace('_', ' ');
    }

    /** Display names of all parameters, joined for messages like "required when age is empty". */
    String displayNamesOfParams() {
        return params().stream().map(this::displayName).collect(Collectors.joining(", "));
    }

    boolean hasNumericRule() {
        return fieldRules.stream().anyMatch(r -> "numeric".equals(r.name()) || "integer".equals(r.name()));
    }

    /**
     * The value's size for min/max/between/size: the number itself for numbers (or numeric strings
     * when the field declares {@code numeric}), otherwise the length. {@code null} when the value
     * has no measurable size.
     */
    BigDecimal measure() {
        if (value instanceof Number || hasNumericRule()) {
            BigDecimal number = Values.toNumber(value);
            if (number != null) {
                return number;
            }
        }
        int length = Values.length(value);
        return length >= 0 ? BigDecimal.valueOf(length) : null;
    }

    /** Message variant for size rules: {@code numeric}, {@code array} or {@code string}. */
    String sizeKind() {
        if (value instanceof Number || (hasNumericRule() && Values.toNumber(value) != null)) {
            return "numeric";
        }
        return Values.isCollectionLike(value) ? "array" : "string";
    }

    static Object lookup(Map<String, Object> values, String path) {
        if (values.containsKey(path) || path.indexOf('.') < 0) {
            return values.get(path);
        }
        Object current = values;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(segment);
        }
        return current;
    }
}
