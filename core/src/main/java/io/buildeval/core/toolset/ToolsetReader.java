package io.buildeval.core.toolset;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.buildeval.core.construction.ElementLocation;
import io.buildeval.core.error.InvalidConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads toolset definitions from YAML, validated against the bundled
 * {@code schemas/toolset-schema.json}.
 *
 * <pre>
 * defaultToolsVersion: Current
 * toolsets:
 *   - toolsVersion: Current
 *     toolsPath: /opt/build/bin
 *     properties:
 *       MSBuildExtensionsPath: /opt/build/extensions
 *     defaultSubToolsetVersion: "17.0"
 *     subToolsets:
 *       "17.0":
 *         properties:
 *           VCTargetsPath: /opt/build/vc
 *     importSearchPaths:
 *       unix:
 *         MSBuildExtensionsPath: [/usr/lib/build, "$(HOME)/.build"]
 * </pre>
 *
 * <p>Thread-safe.
 */
public final class ToolsetReader {

    /**
     * Error code for toolset files that cannot be read or do not match the
     * schema.
     */
    public static final String INVALID_TOOLSET_CODE = "MSB4143";

    private static final Logger LOG = LoggerFactory.getLogger(ToolsetReader.class);
    private static final String SCHEMA_RESOURCE = "schemas/toolset-schema.json";
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final JsonSchema schema;

    public ToolsetReader() {
        this.schema = loadSchema();
    }

    /**
     * Reads a toolset file into a new registry.
     *
     * @throws InvalidConfigurationException if the file cannot be read or is
     *     not a valid definition
     */
    public ToolsetRegistry read(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new InvalidConfigurationException(
                    "Failed to read toolset definitions: " + e.getMessage(),
                    e,
                    INVALID_TOOLSET_CODE,
                    ElementLocation.ofFile(path.toString()));
        }
        ToolsetRegistry registry = read(root, path.toString());
        LOG.info("Toolsets loaded: file={}, versions={}, default={}",
                path, registry.toolsVersions(), registry.defaultToolsVersion());
        return registry;
    }

    /** Reads toolset definitions from YAML text. */
    public ToolsetRegistry readString(String yaml) {
        try {
            return read(YAML_MAPPER.readTree(yaml), "<string>");
        } catch (IOException e) {
            throw new InvalidConfigurationException(
                    "Failed to parse toolset definitions: " + e.getMessage(), e, INVALID_TOOLSET_CODE, null);
        }
    }

    private ToolsetRegistry read(JsonNode root, String source) {
        ElementLocation location = ElementLocation.ofFile(source);
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new InvalidConfigurationException(
                    "Toolset definitions are empty", INVALID_TOOLSET_CODE, location);
        }
        Set<ValidationMessage> errors = schema.validate(root);
        if (!errors.isEmpty()) {
            String detail = errors.stream().map(ValidationMessage::getMessage).collect(Collectors.joining("; "));
            throw new InvalidConfigurationException(
                    "Invalid toolset definitions in " + source + ": " + detail, INVALID_TOOLSET_CODE, location);
        }

        ToolsetRegistry registry = new ToolsetRegistry();
        for (JsonNode node : root.get("toolsets")) {
            registry.register(toToolset(node));
        }
        JsonNode defaultVersion = root.get("defaultToolsVersion");
        if (defaultVersion != null) {
            if (!registry.hasToolset(defaultVersion.asText())) {
                throw new InvalidConfigurationException(
                        "defaultToolsVersion '" + defaultVersion.asText() + "' does not name a toolset",
                        INVALID_TOOLSET_CODE,
                        location);
            }
            registry.setDefaultToolsVersion(defaultVersion.asText());
        }
        return registry;
    }

    private static Toolset toToolset(JsonNode node) {
        Toolset.Builder builder = Toolset.builder(node.get("toolsVersion").asText());
        JsonNode toolsPath = node.get("toolsPath");
        if (toolsPath != null) {
            builder.toolsPath(Path.of(toolsPath.asText()));
        }
        forEachField(node.get("properties"), (name, value) -> builder.property(name, value.asText()));
        JsonNode defaultSub = node.get("defaultSubToolsetVersion");
        if (defaultSub != null) {
            builder.defaultSubToolsetVersion(defaultSub.asText());
        }
        forEachField(node.get("subToolsets"), (version, sub) -> {
            Map<String, String> props = new LinkedHashMap<>();
            forEachField(sub.get("properties"), (name, value) -> props.put(name, value.asText()));
            builder.subToolset(new SubToolset(version, props));
        });
        forEachField(node.get("importSearchPaths"), (os, byProperty) ->
                forEachField(byProperty, (property, paths) -> {
                    List<String> list = new ArrayList<>();
                    paths.forEach(p -> list.add(p.asText()));
                    builder.searchPaths(os, property, list);
                }));
        return builder.build();
    }

    private static void forEachField(JsonNode node, BiConsumer<String, JsonNode> action) {
        if (node == null || !node.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            action.accept(field.getKey(), field.getValue());
        }
    }

    private static JsonSchema loadSchema() {
        try (InputStream in = ToolsetReader.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource: " + SCHEMA_RESOURCE);
            }
            return SCHEMA_FACTORY.getSchema(new ObjectMapper().readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load " + SCHEMA_RESOURCE, e);
        }
    }
}
