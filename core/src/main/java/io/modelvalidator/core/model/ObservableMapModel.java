package io.modelvalidator.core.model;

import io.modelvalidator.core.spi.ModelChange;
import io.modelvalidator.core.spi.ModelChangeListener;
import io.modelvalidator.core.spi.ObservableModel;
import io.modelvalidator.core.spi.Subscription;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Map-backed {@link ObservableModel}. Every mutation notifies subscribers synchronously before the
 * mutating method returns:
 *
 * <ul>
 *   <li>{@link #put} of a new field → {@link ModelChange.Kind#ADD}
 *   <li>{@link #put} changing an existing value → {@link ModelChange.Kind#UPDATE}; writing an equal
 *       value publishes nothing
 *   <li>{@link #remove} of a present field → {@link ModelChange.Kind#REMOVE}
 *   <li>{@link #replaceAll} → one {@link ModelChange#bulkUpdate()} without a field name
 * </ul>
 *
 * <p>Not thread-safe for mutation; subscribe/unsubscribe may happen from any thread.
 */
public final class ObservableMapModel implements ObservableModel {

    private final Map<String, Object> values = new LinkedHashMap<>();
    private final List<ModelChangeListener> listeners = new CopyOnWriteArrayList<>();

    public ObservableMapModel() {}

    /** Creates a model holding a copy of the given values (null values allowed). */
    public ObservableMapModel(Map<String, ?> initialValues) {
        values.putAll(Objects.requireNonNull(initialValues, "initialValues must not be null"));
    }

    /** Fluent factory: {@code ObservableMapModel.of("name", "", "age", null)}. */
    public static ObservableMapModel of(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("keysAndValues must hold an even number of elements");
        }
        ObservableMapModel model = new ObservableMapModel();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            model.values.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return model;
    }

    public Object get(String field) {
        return values.get(field);
    }

    public boolean containsField(String field) {
        return values.containsKey(field);
    }

    public Set<String> fields() {
        return Collections.unmodifiableSet(values.keySet());
    }

    /**
     * Sets a field value and notifies subscribers.
     *
     * @return the previous value, or {@code null}
     */
    public Object put(String field, Object value) {
        Objects.requireNonNull(field, "field must not be null");
        boolean present = values.containsKey(field);
        Object previous = values.put(field, value);
        if (!present) {
            publish(ModelChange.add(field));
        } else if (!Objects.equals(previous, value)) {
            publish(ModelChange.update(field));
        }
        return previous;
    }

    /**
     * Removes a field and notifies subscribers if it was present.
     *
     * @return the removed value, or {@code null}
     */
    public Object remove(String field) {
        if (!values.containsKey(field)) {
            return null;
        }
        Object previous = values.remove(field);
        publish(ModelChange.remove(field));
        return previous;
    }

    /** Replaces the whole content and publishes a single bulk update. */
    public void replaceAll(Map<String, ?> newValues) {
        Objects.requireNonNull(newValues, "newValues must not be null");
        values.clear();
        values.putAll(newValues);
        publish(ModelChange.bulkUpdate());
    }

    @Override
    public Subscription subscribe(ModelChangeListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.add(listener);
        AtomicBoolean active = new AtomicBoolean(true);
        return () -> {
            if (active.compareAndSet(true, false)) {
                listeners.remove(listener);
            }
        };
    }

    /** Number of active subscribers. */
    public int subscriberCount() {
        return listeners.size();
    }

    @Override
    public Map<String, Object> snapshot() {
        return new LinkedHashMap<>(values);
    }

    private void publish(ModelChange change) {
        for (ModelChangeListener listener : listeners) {
            listener.onChange(change);
        }
    }

    @Override
    public String toString() {
        return "ObservableMapModel" + values;
    }
}
