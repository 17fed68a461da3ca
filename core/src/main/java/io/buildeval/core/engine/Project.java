package io.buildeval.core.engine;

import io.buildeval.core.construction.ProjectRootElement;
import io.buildeval.core.evaluation.EvaluatedProject;
import io.buildeval.core.evaluation.ResolvedImport;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A loaded project: its global properties and the latest evaluation.
 *
 * <p>
 * Thread-safe: the current evaluation is held in an {@link AtomicReference} and
 * replaced only after a re-evaluation completed. A re-evaluation that fails
 * leaves the previous result in place.
 */
public final class Project {

    private static final Logger LOG = LoggerFactory.getLogger(Project.class);

    private final ProjectCollection collection;
    private final Path fullPath;
    private final String toolsVersion;
    private final Map<String, String> globalProperties = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final AtomicReference<EvaluatedProject> evaluated = new AtomicReference<>();
    private volatile boolean dirty;

    Project(ProjectCollection collection, Path fullPath, Map<String, String> globalProperties, String toolsVersion) {
        this.collection = collection;
        this.fullPath = fullPath;
        this.toolsVersion = toolsVersion;
        this.globalProperties.putAll(globalProperties);
        this.evaluated.set(collection.evaluate(fullPath, snapshot(), toolsVersion));
    }

    public Path fullPath() {
        return fullPath;
    }

    public ProjectCollection collection() {
        return collection;
    }

    /** The result of the latest successful evaluation. */
    public EvaluatedProject evaluated() {
        return evaluated.get();
    }

    /**
     * Requests a re-evaluation on the next {@link #reevaluateIfNecessary()}.
     */
    public void markDirty() {
        dirty = true;
    }

    /**
     * Whether the next {@link #reevaluateIfNecessary()} evaluates again: the
     * project was marked dirty, a global property changed, or the project file
     * or one of its imports changed on disk.
     */
    public boolean isDirty() {
        if (dirty) {
            return true;
        }
        EvaluatedProject current = evaluated.get();
        if (isStale(current.xml())) {
            return true;
        }
        for (ResolvedImport resolved : current.importsIncludingDuplicates()) {
            if (isStale(resolved.importedProject())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Evaluates again when {@link #isDirty()}.
     *
     * @return {@code true} when a new evaluation was published
     * @throws io.buildeval.core.error.ProjectEvaluationException when the
     *     evaluation fails; the previous result stays current
     */
    public synchronized boolean reevaluateIfNecessary() {
        if (!isDirty()) {
            return false;
        }
        EvaluatedProject next = collection.evaluate(fullPath, snapshot(), toolsVersion);
        evaluated.set(next);
        dirty = false;
        LOG.debug("Project re-evaluated: project={}", fullPath);
        return true;
    }

    /**
     * Sets a global property. Marks the project dirty when the value changed.
     *
     * @return {@code true} when the value changed
     */
    public synchronized boolean setGlobalProperty(String name, String value) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
        String previous = globalProperties.put(name, value);
        if (value.equals(previous)) {
            return false;
        }
        dirty = true;
        return true;
    }

    /**
     * Removes a global property. Marks the project dirty when it was set.
     *
     * @return {@code true} when the property was set
     */
    public synchronized boolean removeGlobalProperty(String name) {
        if (globalProperties.remove(name) == null) {
            return false;
        }
        dirty = true;
        return true;
    }

    /** Snapshot of the global properties, by case-insensitive name. */
    public synchronized Map<String, String> globalProperties() {
        return Collections.unmodifiableMap(snapshot());
    }

    private synchronized Map<String, String> snapshot() {
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(globalProperties);
        return copy;
    }

    private static boolean isStale(ProjectRootElement file) {
        // in-memory trees carry the epoch and have no file to compare against
        if (Instant.EPOCH.equals(file.lastWriteTime()) || !Files.exists(file.fullPath())) {
            return false;
        }
        try {
            return !Files.getLastModifiedTime(file.fullPath()).toInstant().equals(file.lastWriteTime());
        } catch (IOException e) {
            LOG.debug("Cannot read last write time: file={}, error={}", file.fullPath(), e.getMessage());
            return true;
        }
    }

    @Override
    public String toString() {
        return "Project[" + fullPath + "]";
    }
}
