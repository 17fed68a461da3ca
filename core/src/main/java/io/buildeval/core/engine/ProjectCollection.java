package io.buildeval.core.engine;

import io.buildeval.core.cache.ProjectRootElementCache;
import io.buildeval.core.construction.ProjectRootElement;
import io.buildeval.core.construction.ProjectXmlParser;
import io.buildeval.core.evaluation.EvaluatedProject;
import io.buildeval.core.evaluation.EvaluationSettings;
import io.buildeval.core.evaluation.Evaluator;
import io.buildeval.core.evaluation.condition.ConditionEvaluator;
import io.buildeval.core.sdk.CachingSdkResolverService;
import io.buildeval.core.sdk.DefaultSdkResolverService;
import io.buildeval.core.sdk.SdkResolverRegistry;
import io.buildeval.core.sdk.SdkResolverService;
import io.buildeval.core.spi.EvaluationListener;
import io.buildeval.core.toolset.Toolset;
import io.buildeval.core.toolset.ToolsetRegistry;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shares the parsed-file cache, toolsets, SDK resolution, listener and settings
 * between the projects it loads. Thread-safe; projects may be loaded and
 * evaluated concurrently.
 */
public final class ProjectCollection {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectCollection.class);

    private final ToolsetRegistry toolsets;
    private final EvaluationSettings settings;
    private final ProjectRootElementCache cache;
    private final Evaluator evaluator;
    private final List<Project> loadedProjects = new CopyOnWriteArrayList<>();

    /**
     * A collection with the {@code Current} toolset, no SDK resolvers and
     * settings from the environment.
     */
    public ProjectCollection() {
        this(ToolsetRegistry.withCurrentToolset(), new SdkResolverRegistry(), EvaluationListener.NONE,
                EvaluationSettings.fromEnvironment());
    }

    /**
     * @param toolsets toolsets by tools version
     * @param resolvers SDK resolvers consulted for SDK imports
     * @param listener receives evaluation events of every project in the
     *     collection
     * @param settings evaluation switches;
     *     {@link EvaluationSettings#cacheSize()} sizes the cache
     */
    public ProjectCollection(
            ToolsetRegistry toolsets,
            SdkResolverRegistry resolvers,
            EvaluationListener listener,
            EvaluationSettings settings) {
        this(toolsets, new CachingSdkResolverService(new DefaultSdkResolverService(resolvers)), listener, settings,
                System.getenv());
    }

    /**
     * @param environment environment variables visible to evaluations as
     *     properties
     */
    public ProjectCollection(
            ToolsetRegistry toolsets,
            SdkResolverService sdkResolver,
            EvaluationListener listener,
            EvaluationSettings settings,
            Map<String, String> environment) {
        this.toolsets = Objects.requireNonNull(toolsets, "toolsets must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.cache = new ProjectRootElementCache(new ProjectXmlParser()::parse, true, settings.cacheSize());
        this.evaluator = new Evaluator(cache, sdkResolver, new ConditionEvaluator(), listener, settings, environment);
    }

    public ToolsetRegistry toolsets() {
        return toolsets;
    }

    public EvaluationSettings settings() {
        return settings;
    }

    public ProjectRootElementCache cache() {
        return cache;
    }

    /** Loads and evaluates a project without global properties. */
    public Project loadProject(Path path) {
        return loadProject(path, Map.of());
    }

    /**
     * Loads and evaluates a project with the toolset the project file names, or
     * the default one.
     *
     * @param globalProperties copied; later changes to the map do not affect
     *     the project
     * @throws io.buildeval.core.error.ProjectEvaluationException when the
     *     project cannot be evaluated
     */
    public Project loadProject(Path path, Map<String, String> globalProperties) {
        return loadProject(path, globalProperties, null);
    }

    /**
     * @param toolsVersion tools version overriding the project file's;
     *     {@code null} to use the file's
     * @throws IllegalArgumentException when no toolset is registered for the
     *     requested version
     */
    public Project loadProject(Path path, Map<String, String> globalProperties, String toolsVersion) {
        Objects.requireNonNull(path, "path must not be null");
        Path fullPath = path.toAbsolutePath().normalize();
        Project project = new Project(this, fullPath, Map.copyOf(globalProperties), toolsVersion);
        loadedProjects.add(project);
        LOG.info("Project loaded: project={}, globalProperties={}", fullPath, globalProperties.size());
        return project;
    }

    /** Projects loaded by this collection, in load order. */
    public List<Project> loadedProjects() {
        return List.copyOf(loadedProjects);
    }

    /** Forgets the loaded projects and the parsed files. */
    public void unloadAllProjects() {
        loadedProjects.clear();
        cache.clear();
    }

    EvaluatedProject evaluate(Path fullPath, Map<String, String> globalProperties, String toolsVersion) {
        ProjectRootElement xml = cache.get(fullPath, true);
        return evaluator.evaluate(xml, globalProperties, selectToolset(xml, toolsVersion));
    }

    private Toolset selectToolset(ProjectRootElement xml, String toolsVersion) {
        if (toolsVersion != null) {
            return toolsets.requireToolset(toolsVersion);
        }
        return toolsets.getToolset(xml.toolsVersion()).orElseGet(toolsets::defaultToolset);
    }
}
