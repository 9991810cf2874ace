package io.modelvalidator.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration of a validator: which rules to enforce, an optional initial model, translation
 * keys for custom messages and attribute names, and whether validation is manual.
 *
 * <p>Custom error keys map a selector ({@code rule} or {@code rule.field}) to a message key; the
 * key is passed through the {@link io.modelvalidator.core.spi.LocalizationProvider} on every pass.
 * Attribute-name keys map a field to a display-name key, translated the same way.
 *
 * <p>Only the map <em>values</em> are translated. Selectors and field names on the key side are
 * matched verbatim against rule names and model fields and are never passed to the provider, so
 * {@code customError("required.name", "errors.name.required")} looks up {@code
 * errors.name.required}, not {@code required.name}.
 *
 * <p>Immutable. Use {@link #builder()}.
 */
public final class ValidationConfig {

    private final RuleSpec rules;
    private final Object model;
    private final Map<String, String> customErrors;
    private final Map<String, String> attributeNames;
    private final boolean manual;

    private ValidationConfig(Builder builder) {
        this.rules = Objects.requireNonNull(builder.rules, "rules must not be null");
        this.model = builder.model;
        this.customErrors = Collections.unmodifiableMap(new LinkedHashMap<>(builder.customErrors));
        this.attributeNames = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributeNames));
        this.manual = builder.manual;
    }

    public static Builder builder() {
        return new Builder();
    }

    public RuleSpec rules() {
        return rules;
    }

    /** The initial model, or {@code null} if the model is supplied later via {@code setModel}. */
    public Object model() {
        return model;
    }

    public Map<String, String> customErrors() {
        return customErrors;
    }

    public Map<String, String> attributeNames() {
        return attributeNames;
    }

    /** If {@code true}, model mutations do not trigger validation. Defaults to {@code false}. */
    public boolean manual() {
        return manual;
    }

    /** Returns a builder pre-populated with this config's values. */
    public Builder toBuilder() {
        return new Builder()
                .rules(rules)
                .model(model)
                .customErrors(customErrors)
                .attributeNames(attributeNames)
                .manual(manual);
    }

    @Override
    public String toString() {
        return "ValidationConfig[rules=" + rules.fields() + ", manual=" + manual + ", model="
                + (model != null ? model.getClass().getSimpleName() : "none") + "]";
    }

    /** Builder for {@link ValidationConfig}. */
    public static final class Builder {

        private RuleSpec rules;
        private Object model;
        private final Map<String, String> customErrors = new LinkedHashMap<>();
        private final Map<String, String> attributeNames = new LinkedHashMap<>();
        private boolean manual;

        Builder() {}

        public Builder rules(RuleSpec rules) {
            this.rules = rules;
            return this;
        }

        public Builder rules(Map<String, String> rules) {
            this.rules = RuleSpec.of(rules);
            return this;
        }

        public Builder model(Object model) {
            this.model = model;
            return this;
        }

        public Builder customError(String selector, String messageKey) {
            customErrors.put(selector, messageKey);
            return this;
        }

        public Builder customErrors(Map<String, String> customErrors) {
            this.customErrors.clear();
            this.customErrors.putAll(customErrors);
            return this;
        }

        public Builder attributeName(String field, String nameKey) {
            attributeNames.put(field, nameKey);
            return this;
        }

        public Builder attributeNames(Map<String, String> attributeNames) {
            this.attributeNames.clear();
            this.attributeNames.putAll(attributeNames);
            return this;
        }

        public Builder manual(boolean manual) {
            this.manual = manual;
            return this;
        }

        public ValidationConfig build() {
            return new ValidationConfig(this);
        }
    }
}
