package io.modelvalidator.core.engine;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Set of field names currently permitted to display errors. Grows through validation, shrinks only
 * through {@link #clear()}.
 */
public final class DirtyFieldLedger {

    private final Set<String> fields = new LinkedHashSet<>();
    private final Set<String> view = Collections.unmodifiableSet(fields);

    /**
     * Marks the field as touched.
     *
     * @return {@code true} if the field was not touched before
     */
    public boolean markDirty(String field) {
        return fields.add(field);
    }

    public boolean has(String field) {
        return fields.contains(field);
    }

    public void clear() {
        fields.clear();
    }

    /** {@code true} while no field has been touched. */
    public boolean isEmpty() {
        return fields.isEmpty();
    }

    public int size() {
        return fields.size();
    }

    /** Live, unmodifiable view in insertion order. */
    public Set<String> view() {
        return view;
    }

    /** Immutable copy of the current contents. */
    public Set<String> snapshot() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(fields));
    }
}
