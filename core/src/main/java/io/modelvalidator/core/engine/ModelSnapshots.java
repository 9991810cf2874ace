package io.modelvalidator.core.engine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.modelvalidator.core.spi.ObservableModel;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts any supported model representation into the plain field→value map rule evaluators
 * consume. The source model is never mutated and never retained.
 *
 * <ul>
 *   <li>{@code null} → empty map (every field evaluates as absent)
 *   <li>{@link ObservableModel} → {@link ObservableModel#snapshot()}
 *   <li>{@link Map} → shallow copy with string keys; values kept as-is
 *   <li>{@link JsonNode} object → converted with Jackson
 *   <li>any other bean → converted with Jackson; {@code java.time} values become ISO-8601 strings
 * </ul>
 *
 * <p>Thread-safe, stateless utility class.
 */
public final class ModelSnapshots {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private ModelSnapshots() {}

    /**
     * Returns a plain, independent field→value map for the given model.
     *
     * @throws IllegalArgumentException if the model is a scalar or array that has no fields
     */
    public static Map<String, Object> toFieldValues(Object model) {
        if (model == null) {
            return new LinkedHashMap<>();
        }
        if (model instanceof ObservableModel observable) {
            return new LinkedHashMap<>(observable.snapshot());
        }
        if (model instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, value) -> copy.put(String.valueOf(key), value));
            return copy;
        }
        if (model instanceof JsonNode node) {
            if (node.isNull() || node.isMissingNode()) {
                return new LinkedHashMap<>();
            }
            if (!node.isObject()) {
                throw new IllegalArgumentException("JSON model must be an object, got: " + node.getNodeType());
            }
            return MAPPER.convertValue(node, MAP_TYPE);
        }
        if (model instanceof CharSequence || model instanceof Number || model instanceof Boolean
                || model.getClass().isArray() || model instanceof Iterable<?>) {
            throw new IllegalArgumentException(
                    "Model must be an object with fields, got: " + model.getClass().getName());
        }
        return MAPPER.convertValue(model, MAP_TYPE);
    }
}
