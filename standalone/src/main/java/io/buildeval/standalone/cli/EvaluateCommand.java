package io.buildeval.standalone.cli;

import io.buildeval.core.engine.Project;
import io.buildeval.core.engine.ProjectCollection;
import io.buildeval.core.evaluation.EvaluatedProject;
import io.buildeval.core.evaluation.EvaluationSettings;
import io.buildeval.core.evaluation.ItemNameCaseSensitivity;
import io.buildeval.core.evaluation.LoadSetting;
import io.buildeval.core.evaluation.PropertyTracking;
import io.buildeval.core.sdk.CachingSdkResolverService;
import io.buildeval.core.sdk.DefaultSdkResolverService;
import io.buildeval.core.sdk.DirectorySdkResolver;
import io.buildeval.core.sdk.SdkResolverRegistry;
import io.buildeval.core.spi.EvaluationListener;
import io.buildeval.core.toolset.ToolsetReader;
import io.buildeval.core.toolset.ToolsetRegistry;
import io.buildeval.standalone.config.CliConfig;
import io.buildeval.standalone.config.ConfigLoadException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates the configured project and prints the result as JSON.
 *
 * <p>
 * Separate from {@link io.buildeval.standalone.StandaloneMain} so tests can run
 * it without going through {@code main()}.
 */
public final class EvaluateCommand {

    private static final Logger LOG = LoggerFactory.getLogger(EvaluateCommand.class);

    private final CliConfig config;
    private final Map<String, String> environment;

    /**
     * @param environment environment variables visible to the evaluation as
     *     properties
     */
    public EvaluateCommand(CliConfig config, Map<String, String> environment) {
        this.config = config;
        this.environment = Map.copyOf(environment);
    }

    /**
     * Runs the evaluation and writes the JSON document to {@code out}.
     *
     * @throws io.buildeval.core.error.ProjectEvaluationException when the
     *     project cannot be evaluated
     * @throws ConfigLoadException when a configured setting name is unknown
     */
    public EvaluatedProject run(PrintStream out) {
        long start = System.nanoTime();
        ToolsetRegistry toolsets = config.toolsetFile() != null
                ? new ToolsetReader().read(Path.of(config.toolsetFile()))
                : ToolsetRegistry.withCurrentToolset();

        SdkResolverRegistry resolvers = new SdkResolverRegistry();
        if (!config.sdkRoots().isEmpty()) {
            List<Path> roots = new ArrayList<>();
            config.sdkRoots().forEach(root -> roots.add(Path.of(root)));
            resolvers.register(new DirectorySdkResolver(roots));
        }

        WarningCollector warnings = new WarningCollector();
        ProjectCollection collection = new ProjectCollection(
                toolsets,
                new CachingSdkResolverService(new DefaultSdkResolverService(resolvers)),
                warnings,
                settings(config),
                environment);

        Project project = collection.loadProject(Path.of(config.project()), config.globalProperties(), config.toolsVersion());
        EvaluatedProject evaluated = project.evaluated();
        out.println(new EvaluationJsonWriter(config.includeEnvironment(), config.prettyPrint())
                .write(evaluated, warnings.warnings()));
        LOG.info("Evaluation written: project={}, warnings={}, durationMs={}",
                evaluated.fullPath(), warnings.warnings().size(), (System.nanoTime() - start) / 1_000_000);
        return evaluated;
    }

    static EvaluationSettings settings(CliConfig config) {
        EvaluationSettings.Builder builder = EvaluationSettings.builder()
                .warnOnUninitializedProperty(config.warnOnUninitializedProperty())
                .itemNameCaseSensitivity(config.caseSensitiveItemNames()
                        ? ItemNameCaseSensitivity.CASE_SENSITIVE
                        : ItemNameCaseSensitivity.CASE_INSENSITIVE)
                .propertyTracking(PropertyTracking.fromFlags(config.propertyTracking()))
                .logImports(config.logImports());
        for (String name : config.loadSettings()) {
            builder.loadSetting(loadSetting(name));
        }
        return builder.build();
    }

    /**
     * Accepts {@code IGNORE_MISSING_IMPORTS}, {@code ignore-missing-imports}
     * and {@code IgnoreMissingImports}.
     */
    static LoadSetting loadSetting(String name) {
        String normalized = name.trim()
                .replace('-', '_')
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .toUpperCase(Locale.ROOT);
        try {
            return LoadSetting.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new ConfigLoadException("Unknown load setting: " + name, e);
        }
    }

    /** Keeps the warnings of the evaluation for the JSON output. */
    static final class WarningCollector implements EvaluationListener {
        private final List<WarningEvent> warnings = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void onWarning(WarningEvent event) {
            warnings.add(event);
        }

        List<WarningEvent> warnings() {
            synchronized (warnings) {
                return List.copyOf(warnings);
            }
        }
    }
}
