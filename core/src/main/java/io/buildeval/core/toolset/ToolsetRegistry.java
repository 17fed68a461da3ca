package io.buildeval.core.toolset;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for toolsets, keyed by tools version. Thread-safe. The first
 * registered toolset is the default until {@link #setDefaultToolsVersion} names
 * another.
 */
public final class ToolsetRegistry {

    /** Tools version used when nothing is configured. */
    public static final String CURRENT = "Current";

    private final Map<String, Toolset> toolsets = new ConcurrentHashMap<>();
    private volatile String defaultToolsVersion;

    /** A registry holding only an empty {@value #CURRENT} toolset. */
    public static ToolsetRegistry withCurrentToolset() {
        ToolsetRegistry registry = new ToolsetRegistry();
        registry.register(Toolset.builder(CURRENT).build());
        return registry;
    }

    /**
     * Registers a toolset, replacing one with the same tools version.
     *
     * @throws NullPointerException if toolset is null
     * @throws IllegalArgumentException if toolset.toolsVersion() is empty
     */
    public void register(Toolset toolset) {
        if (toolset == null) {
            throw new NullPointerException("toolset must not be null");
        }
        String version = toolset.toolsVersion();
        if (version.isEmpty()) {
            throw new IllegalArgumentException("toolsVersion must not be null or empty");
        }
        toolsets.put(version, toolset);
        synchronized (this) {
            if (defaultToolsVersion == null) {
                defaultToolsVersion = version;
            }
        }
    }

    public Optional<Toolset> getToolset(String toolsVersion) {
        return toolsVersion == null ? Optional.empty() : Optional.ofNullable(toolsets.get(toolsVersion));
    }

    /**
     * @throws IllegalArgumentException if no toolset is registered with the
     *     given version
     */
    public Toolset requireToolset(String toolsVersion) {
        return getToolset(toolsVersion)
                .orElseThrow(() ->
                        new IllegalArgumentException("No toolset registered for version: '" + toolsVersion + "'"));
    }

    /**
     * @throws IllegalStateException if no toolset is registered
     */
    public Toolset defaultToolset() {
        String version = defaultToolsVersion;
        if (version == null) {
            throw new IllegalStateException("No toolset registered");
        }
        return requireToolset(version);
    }

    /**
     * @throws IllegalArgumentException if no toolset is registered with the
     *     given version
     */
    public void setDefaultToolsVersion(String toolsVersion) {
        requireToolset(toolsVersion);
        this.defaultToolsVersion = toolsVersion;
    }

    public String defaultToolsVersion() {
        return defaultToolsVersion;
    }

    public List<String> toolsVersions() {
        return List.copyOf(toolsets.keySet());
    }

    public int size() {
        return toolsets.size();
    }

    public boolean hasToolset(String toolsVersion) {
        return toolsets.containsKey(toolsVersion);
    }
}
