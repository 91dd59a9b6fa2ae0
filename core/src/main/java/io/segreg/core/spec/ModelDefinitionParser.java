package io.segreg.core.spec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.segreg.core.error.ModelDefinitionException;
import io.segreg.core.model.ModelDefinition;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parses YAML model definition files into {@link ModelDefinition} instances.
 *
 * <pre>
 * id: piecewise-ar
 * family: gaussian
 * segments:
 *   - "y ~ 1 + ar(1)"
 *   - "~ 0 + x"
 * priors:
 *   cp_1: "dunif(20, 80)"
 * </pre>
 *
 * The document is validated against the bundled {@code model-definition.schema.json}
 * before any field is read, so unknown keys and wrong types fail with the schema's own
 * messages.
 *
 * <p>
 * Thread-safe: the YAML mapper and the compiled schema are shared immutable state.
 */
public final class ModelDefinitionParser {

    static final String SCHEMA_RESOURCE = "/schema/model-definition.schema.json";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final JsonSchema SCHEMA = loadSchema();

    /**
     * Parses a YAML model definition file.
     *
     * @param path path to the YAML file
     * @return the parsed definition
     * @throws ModelDefinitionException if the file cannot be read, is not valid YAML, or
     *                                  does not conform to the schema
     */
    public ModelDefinition parse(Path path) {
        String source = path.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new ModelDefinitionException("Failed to read or parse YAML: " + e.getMessage(), e, null, source);
        }
        return fromTree(root, source);
    }

    /**
     * Parses YAML text.
     *
     * @param yaml   the YAML document
     * @param source label used in error messages (e.g. a resource name)
     */
    public ModelDefinition parse(String yaml, String source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new ModelDefinitionException("Failed to parse YAML: " + e.getOriginalMessage(), e, null, source);
        }
        return fromTree(root, source);
    }

    private ModelDefinition fromTree(JsonNode root, String source) {
        if (root == null || root.isMissingNode() || !root.isObject()) {
            throw new ModelDefinitionException("Model definition must be a YAML mapping", null, source);
        }
        String id = root.path("id").isTextual() ? root.get("id").asText() : null;

        Set<ValidationMessage> errors = SCHEMA.validate(root);
        if (!errors.isEmpty()) {
            String detail = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new ModelDefinitionException("Model definition does not match schema: " + detail, id, source);
        }

        List<String> segments = new ArrayList<>();
        root.get("segments").forEach(node -> segments.add(node.asText()));

        Map<String, String> priors = new LinkedHashMap<>();
        JsonNode priorsNode = root.get("priors");
        if (priorsNode != null) {
            Iterator<Map.Entry<String, JsonNode>> fields = priorsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                priors.put(field.getKey(), field.getValue().asText());
            }
        }

        return ModelDefinition.builder()
                .id(id)
                .description(optionalString(root, "description"))
                .family(root.has("family") ? root.get("family").asText() : "gaussian")
                .link(optionalString(root, "link"))
                .predictor(optionalString(root, "predictor"))
                .segments(segments)
                .priors(priors)
                .build();
    }

    private static String optionalString(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = ModelDefinitionParser.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Schema resource not found on classpath: " + SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + SCHEMA_RESOURCE, e);
        }
    }
}
