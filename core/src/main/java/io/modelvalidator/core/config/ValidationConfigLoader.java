package io.modelvalidator.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.modelvalidator.core.error.ConfigLoadException;
import io.modelvalidator.core.model.RuleSpec;
import io.modelvalidator.core.model.ValidationConfig;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a {@link ValidationConfig} from YAML.
 *
 * <pre>
 * rules:
 *   name: required
 *   age: numeric|max:99
 * custom-errors:
 *   required.name: errors.name.required
 * attribute-names:
 *   birthday: attr.birthday
 * manual: false
 * </pre>
 *
 * <p>The document is checked against the bundled {@code validation-config.schema.json} before it
 * is mapped, so unknown keys and wrongly typed values are rejected at load time instead of being
 * silently ignored. Rule expressions themselves are not interpreted here; the rule evaluator
 * reports malformed rules on the first validation pass.
 *
 * <p>Thread-safe, stateless utility class.
 */
public final class ValidationConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ValidationConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String SCHEMA_RESOURCE = "validation-config.schema.json";
    private static final JsonSchema CONFIG_SCHEMA = loadSchema();

    private ValidationConfigLoader() {
        // utility class
    }

    /**
     * Loads a config from the given YAML file.
     *
     * @param path path to the YAML file
     * @return the config, without a model
     * @throws ConfigLoadException if the file is missing, unreadable, not YAML, or violates the
     *     config schema
     */
    public static ValidationConfig load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        if (!Files.exists(path)) {
            throw new ConfigLoadException("Validation config file not found: " + path, source);
        }
        try (InputStream in = Files.newInputStream(path)) {
            ValidationConfig config = fromTree(YAML_MAPPER.readTree(in), source);
            LOG.info("Validation config loaded: source={} fields={}", source, config.rules().fields());
            return config;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read or parse YAML: " + e.getMessage(), e, source);
        }
    }

    /**
     * Parses a config from YAML text.
     *
     * @param yaml the YAML document
     * @param source label used in error messages
     * @throws ConfigLoadException if the text is not YAML or violates the config schema
     */
    public static ValidationConfig parse(String yaml, String source) {
        Objects.requireNonNull(yaml, "yaml must not be null");
        try {
            return fromTree(YAML_MAPPER.readTree(yaml), source);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML: " + e.getMessage(), e, source);
        }
    }

    private static ValidationConfig fromTree(JsonNode root, String source) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new ConfigLoadException("Validation config is empty", source);
        }
        Set<ValidationMessage> violations = CONFIG_SCHEMA.validate(root);
        if (!violations.isEmpty()) {
            String detail = violations.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ConfigLoadException("Invalid validation config: " + detail, source);
        }

        ValidationConfig.Builder builder = ValidationConfig.builder()
                .rules(RuleSpec.of(textMap(root.get("rules"))))
                .customErrors(textMap(root.path("custom-errors")))
                .attributeNames(textMap(root.path("attribute-names")));
        if (root.has("manual")) {
            builder.manual(root.get("manual").asBoolean());
        }
        return builder.build();
    }

    /** Object node → ordered string map; a missing node yields an empty map. */
    private static Map<String, String> textMap(JsonNode node) {
        Map<String, String> map = new LinkedHashMap<>();
        if (node == null || !node.isObject()) {
            return map;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            map.put(entry.getKey(), entry.getValue().asText());
        }
        return map;
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = ValidationConfigLoader.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource: " + SCHEMA_RESOURCE);
            }
            JsonNode schema = new ObjectMapper().readTree(in);
            return JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012).getSchema(schema);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + SCHEMA_RESOURCE, e);
        }
    }
}
