package io.buildeval.core.cache;

import io.buildeval.core.construction.ProjectRootElement;
import io.buildeval.core.construction.ProjectXmlParser;
import java.io.IOException;
import java.lang.ref.WeakReference;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared cache of parsed project files keyed by normalized absolute path.
 *
 * <p>
 * Entries are held in two tiers: every entry is weakly referenced, and the most
 * recently used entries (bounded by the configured capacity) are also strongly
 * referenced so they survive collection. {@link #evictHotEntries()} drops the
 * strong tier.
 *
 * <p>
 * Thread-safe. A file is parsed by at most one thread at a time and an entry is
 * published only after parsing completed. With auto-reload enabled every lookup
 * compares the entry's captured last-write time with the file on disk and
 * reparses only that entry when it is stale.
 */
public final class ProjectRootElementCache {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectRootElementCache.class);

    public static final int DEFAULT_CAPACITY = 200;

    /** Loads a project file; normally {@link ProjectXmlParser#parse(Path)}. */
    @FunctionalInterface
    public interface Loader {
        ProjectRootElement load(Path fullPath);
    }

    private final Object lock = new Object();
    private final Map<Path, WeakReference<ProjectRootElement>> weakEntries = new HashMap<>();
    private final LinkedHashMap<Path, ProjectRootElement> strongEntries;
    private final Set<Path> explicitlyLoaded = new HashSet<>();
    private final Map<Path, Object> loadLocks = new ConcurrentHashMap<>();
    private final Loader loader;
    private final boolean autoReload;
    private final int capacity;

    public ProjectRootElementCache() {
        this(new ProjectXmlParser()::parse, false, DEFAULT_CAPACITY);
    }

    public ProjectRootElementCache(boolean autoReload) {
        this(new ProjectXmlParser()::parse, autoReload, DEFAULT_CAPACITY);
    }

    /**
     * @param loader parses a file on a cache miss
     * @param autoReload reparse entries whose file changed on disk
     * @param capacity number of most recently used entries kept strongly
     *     reachable
     */
    public ProjectRootElementCache(Loader loader, boolean autoReload, int capacity) {
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative: " + capacity);
        }
        this.autoReload = autoReload;
        this.capacity = capacity;
        this.strongEntries = new LinkedHashMap<>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<Path, ProjectRootElement> eldest) {
                return size() > ProjectRootElementCache.this.capacity;
            }
        };
    }

    /**
     * Returns the cached tree for {@code path}, parsing the file on a miss or
     * when auto-reload finds it stale.
     *
     * @param path project file path
     * @param explicitlyLoaded {@code true} when a caller opened the file as a
     *     project, {@code false} when it was reached as an import
     */
    public ProjectRootElement get(Path path, boolean explicitlyLoaded) {
        Path key = normalize(path);
        ProjectRootElement cached = lookup(key, explicitlyLoaded);
        if (cached != null && !isStale(cached)) {
            return cached;
        }
        Object pathLock = loadLocks.computeIfAbsent(key, k -> new Object());
        try {
            synchronized (pathLock) {
                cached = lookup(key, explicitlyLoaded);
                if (cached != null && !isStale(cached)) {
                    return cached;
                }
                if (cached != null) {
                    LOG.info("Project file changed on disk, reloading: path={}", key);
                }
                ProjectRootElement loaded = loader.load(key);
                store(key, loaded, explicitlyLoaded);
                return loaded;
            }
        } finally {
            // a later load re-checks the cache under a fresh lock, so the entry need not outlive this one
            loadLocks.remove(key, pathLock);
        }
    }

    /**
     * Returns the cached tree without loading on a miss. A stale entry is
     * reparsed when auto-reload is on.
     */
    public Optional<ProjectRootElement> tryGet(Path path) {
        Path key = normalize(path);
        ProjectRootElement cached = lookup(key, false);
        if (cached == null) {
            return Optional.empty();
        }
        if (isStale(cached)) {
            return Optional.of(get(key, false));
        }
        return Optional.of(cached);
    }

    /** Adds or replaces an entry, typically for a tree created in memory. */
    public void addEntry(ProjectRootElement root) {
        Objects.requireNonNull(root, "root must not be null");
        store(normalize(root.fullPath()), root, true);
    }

    /**
     * Drops the strong references to recently used entries; entries become
     * collectible.
     */
    public void evictHotEntries() {
        synchronized (lock) {
            LOG.debug("Evicting {} hot cache entries", strongEntries.size());
            strongEntries.clear();
        }
    }

    /** Forgets entries that were only reached as imports. */
    public void discardImplicitReferences() {
        synchronized (lock) {
            Iterator<Path> it = weakEntries.keySet().iterator();
            while (it.hasNext()) {
                Path key = it.next();
                if (!explicitlyLoaded.contains(key)) {
                    it.remove();
                    strongEntries.remove(key);
                }
            }
        }
    }

    /** Removes every entry. */
    public void clear() {
        synchronized (lock) {
            weakEntries.clear();
            strongEntries.clear();
            explicitlyLoaded.clear();
        }
    }

    /** Number of entries whose tree is still reachable. */
    public int size() {
        synchronized (lock) {
            purgeCollected();
            return weakEntries.size();
        }
    }

    /**
     * Returns {@code true} if the entry for {@code path} is currently in the
     * strong tier.
     */
    public boolean isHot(Path path) {
        synchronized (lock) {
            return strongEntries.containsKey(normalize(path));
        }
    }

    int loadLockCount() {
        return loadLocks.size();
    }

    public boolean isAutoReload() {
        return autoReload;
    }

    private ProjectRootElement lookup(Path key, boolean markExplicit) {
        synchronized (lock) {
            WeakReference<ProjectRootElement> ref = weakEntries.get(key);
            ProjectRootElement root = ref != null ? ref.get() : null;
            if (root == null) {
                if (ref != null) {
                    weakEntries.remove(key);
                    explicitlyLoaded.remove(key);
                }
                return null;
            }
            if (capacity > 0) {
                strongEntries.put(key, root);
            }
            if (markExplicit) {
                explicitlyLoaded.add(key);
            }
            return root;
        }
    }

    private void store(Path key, ProjectRootElement root, boolean markExplicit) {
        synchronized (lock) {
            weakEntries.put(key, new WeakReference<>(root));
            if (capacity > 0) {
                strongEntries.put(key, root);
            }
            if (markExplicit) {
                explicitlyLoaded.add(key);
            }
        }
    }

    private void purgeCollected() {
        weakEntries.entrySet().removeIf(e -> e.getValue().get() == null);
        explicitlyLoaded.retainAll(weakEntries.keySet());
    }

    private boolean isStale(ProjectRootElement root) {
        if (!autoReload || Instant.EPOCH.equals(root.lastWriteTime())) {
            return false;
        }
        Path file = root.fullPath();
        if (!Files.exists(file)) {
            return false;
        }
        try {
            return !Files.getLastModifiedTime(file).toInstant().equals(root.lastWriteTime());
        } catch (IOException e) {
            LOG.debug("Could not read last-write time of {}: {}", file, e.getMessage());
            return false;
        }
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
