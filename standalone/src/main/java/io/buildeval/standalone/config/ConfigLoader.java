package io.buildeval.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Builds a {@link CliConfig} from three layers, each overriding the one before:
 * <ol>
 * <li>the YAML file named by {@code --config}, or {@code buildeval.yaml} in the
 *     current directory when it exists</li>
 * <li>{@code BUILDEVAL_*} environment variables</li>
 * <li>command-line arguments</li>
 * </ol>
 *
 * <p>
 * An environment variable counts as set only when it is defined and not blank.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    static final String DEFAULT_CONFIG_FILE = "buildeval.yaml";

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads the configuration with environment overrides from
     * {@link System#getenv}.
     */
    public static CliConfig load(String[] args) {
        return load(args, System::getenv);
    }

    /**
     * @param args command-line arguments
     * @param envLookup environment variable lookup; {@code null} means
     *     undefined
     * @throws ConfigLoadException when the file or an argument is invalid, or
     *     no project is configured
     */
    public static CliConfig load(String[] args, Function<String, String> envLookup) {
        CliConfig.Builder builder = CliConfig.builder();
        Path configPath = resolveConfigPath(args);
        if (configPath != null) {
            readFile(configPath, builder);
        } else if (Files.isRegularFile(Path.of(DEFAULT_CONFIG_FILE))) {
            readFile(Path.of(DEFAULT_CONFIG_FILE), builder);
        }
        applyEnvOverrides(builder, envLookup);
        applyArguments(builder, args);
        return builder.build();
    }

    /**
     * Returns the path following {@code --config}, or {@code null} when the
     * option is absent.
     *
     * @throws ConfigLoadException when {@code --config} has no value
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new ConfigLoadException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return null;
    }

    /**
     * Reads a YAML configuration file into {@code builder}.
     *
     * @throws ConfigLoadException when the file is missing or is not valid YAML
     */
    static void readFile(Path configPath, CliConfig.Builder builder) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }
        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return;
        }
        mapToConfig(root, builder);
    }

    private static void mapToConfig(JsonNode root, CliConfig.Builder builder) {
        if (root.has("project")) builder.project(root.get("project").asText());
        if (root.has("toolset-file")) builder.toolsetFile(root.get("toolset-file").asText());
        if (root.has("tools-version")) builder.toolsVersion(root.get("tools-version").asText());

        JsonNode properties = root.path("properties");
        for (Iterator<Map.Entry<String, JsonNode>> it = properties.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            builder.globalProperty(entry.getKey(), entry.getValue().asText());
        }
        for (JsonNode sdkRoot : root.path("sdk-roots")) {
            builder.sdkRoot(sdkRoot.asText());
        }

        // Evaluation section
        JsonNode evaluation = root.path("evaluation");
        for (JsonNode setting : evaluation.path("load-settings")) {
            builder.loadSetting(setting.asText());
        }
        if (evaluation.has("warn-on-uninitialized-property"))
            builder.warnOnUninitializedProperty(evaluation.get("warn-on-uninitialized-property").asBoolean());
        if (evaluation.has("case-sensitive-item-names"))
            builder.caseSensitiveItemNames(evaluation.get("case-sensitive-item-names").asBoolean());
        if (evaluation.has("property-tracking"))
            builder.propertyTracking(evaluation.get("property-tracking").asInt());
        if (evaluation.has("log-imports")) builder.logImports(evaluation.get("log-imports").asBoolean());

        // Output section
        JsonNode output = root.path("output");
        if (output.has("include-environment"))
            builder.includeEnvironment(output.get("include-environment").asBoolean());
        if (output.has("pretty")) builder.prettyPrint(output.get("pretty").asBoolean());

        // Logging section
        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());
    }

    private static void applyEnvOverrides(CliConfig.Builder builder, Function<String, String> envLookup) {
        envString(envLookup, "BUILDEVAL_PROJECT", builder::project);
        envString(envLookup, "BUILDEVAL_TOOLSET_FILE", builder::toolsetFile);
        envString(envLookup, "BUILDEVAL_TOOLS_VERSION", builder::toolsVersion);
        envString(envLookup, "BUILDEVAL_LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "BUILDEVAL_LOG_LEVEL", builder::loggingLevel);

        envInt(envLookup, "BUILDEVAL_PROPERTY_TRACKING", builder::propertyTracking);

        envBool(envLookup, "BUILDEVAL_LOG_IMPORTS", builder::logImports);
        envBool(envLookup, "BUILDEVAL_WARN_ON_UNINITIALIZED_PROPERTY", builder::warnOnUninitializedProperty);
        envBool(envLookup, "BUILDEVAL_CASE_SENSITIVE_ITEM_NAMES", builder::caseSensitiveItemNames);

        envString(envLookup, "BUILDEVAL_SDK_ROOTS", value -> {
            for (String root : value.split(File.pathSeparator)) {
                if (!root.isBlank()) {
                    builder.sdkRoot(root.trim());
                }
            }
        });
    }

    /**
     * Applies command-line arguments. A bare argument names the project file.
     *
     * @throws ConfigLoadException for unknown options or options missing their
     *     value
     */
    static void applyArguments(CliConfig.Builder builder, String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--config":
                    i++;
                    break;
                case "--project":
                    builder.project(value(args, ++i, arg));
                    break;
                case "--toolset":
                    builder.toolsetFile(value(args, ++i, arg));
                    break;
                case "--tools-version":
                    builder.toolsVersion(value(args, ++i, arg));
                    break;
                case "--sdk-root":
                    builder.sdkRoot(value(args, ++i, arg));
                    break;
                case "--load-setting":
                    builder.loadSetting(value(args, ++i, arg));
                    break;
                case "--property":
                    globalProperty(builder, value(args, ++i, arg));
                    break;
                case "--log-imports":
                    builder.logImports(true);
                    break;
                case "--warn-uninitialized":
                    builder.warnOnUninitializedProperty(true);
                    break;
                case "--include-environment":
                    builder.includeEnvironment(true);
                    break;
                case "--compact":
                    builder.prettyPrint(false);
                    break;
                default:
                    if (arg.startsWith("-p:") || arg.startsWith("/p:")) {
                        globalProperty(builder, arg.substring(3));
                    } else if (arg.startsWith("-")) {
                        throw new ConfigLoadException("Unknown option: " + arg);
                    } else {
                        builder.project(arg);
                    }
            }
        }
    }

    /** Adds {@code Name=Value}; several pairs may be joined with {@code ;}. */
    private static void globalProperty(CliConfig.Builder builder, String assignments) {
        for (String assignment : assignments.split(";")) {
            if (assignment.isBlank()) {
                continue;
            }
            int eq = assignment.indexOf('=');
            if (eq <= 0) {
                throw new ConfigLoadException("Property must be given as Name=Value: " + assignment);
            }
            builder.globalProperty(assignment.substring(0, eq).trim(), assignment.substring(eq + 1));
        }
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new ConfigLoadException(option + " requires a value");
        }
        return args[index];
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer but was '" + value + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
