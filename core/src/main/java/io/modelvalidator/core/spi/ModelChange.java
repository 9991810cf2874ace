package io.modelvalidator.core.spi;

import java.util.Objects;

/**
 * A mutation notification published by an {@link ObservableModel}.
 *
 * @param kind what happened
 * @param fieldName the mutated field, or {@code null} when the change is not attributable to one
 *     field (bulk replacement)
 */
public record ModelChange(Kind kind, String fieldName) {

    /** The kind of mutation. */
    public enum Kind {
        UPDATE,
        ADD,
        REMOVE
    }

    public ModelChange {
        Objects.requireNonNull(kind, "kind must not be null");
    }

    public static ModelChange update(String fieldName) {
        return new ModelChange(Kind.UPDATE, fieldName);
    }

    public static ModelChange add(String fieldName) {
        return new ModelChange(Kind.ADD, fieldName);
    }

    public static ModelChange remove(String fieldName) {
        return new ModelChange(Kind.REMOVE, fieldName);
    }

    /** A whole-model replacement; no single field is named. */
    public static ModelChange bulkUpdate() {
        return new ModelChange(Kind.UPDATE, null);
    }

    /** Whether the change names a field. */
    public boolean hasFieldName() {
        return fieldName != null && !fieldName.isEmpty();
    }
}
