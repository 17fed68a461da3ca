package io.buildeval.core.toolset;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A named set of base properties, sub-toolset overlays and per-OS import search
 * paths.
 *
 * @param toolsVersion toolset name, e.g. {@code Current}
 * @param toolsPath value of {@code MSBuildToolsPath}, or {@code null}
 * @param properties base properties in declaration order
 * @param subToolsets overlays by selector value, case-insensitive
 * @param defaultSubToolsetVersion overlay used when {@code VisualStudioVersion}
 *     is not set elsewhere, or {@code null}
 * @param importSearchPaths search paths by OS key ({@code windows},
 *     {@code osx}, {@code unix})
 */
public record Toolset(
        String toolsVersion,
        Path toolsPath,
        Map<String, String> properties,
        Map<String, SubToolset> subToolsets,
        String defaultSubToolsetVersion,
        Map<String, List<ProjectImportSearchPaths>> importSearchPaths) {

    public static final String OS_WINDOWS = "windows";
    public static final String OS_OSX = "osx";
    public static final String OS_UNIX = "unix";

    public Toolset {
        Objects.requireNonNull(toolsVersion, "toolsVersion must not be null");
        properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        Map<String, SubToolset> subs = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (subToolsets != null) {
            subs.putAll(subToolsets);
        }
        subToolsets = Collections.unmodifiableMap(subs);
        Map<String, List<ProjectImportSearchPaths>> paths = new LinkedHashMap<>();
        if (importSearchPaths != null) {
            importSearchPaths.forEach((os, list) -> paths.put(os.toLowerCase(Locale.ROOT), List.copyOf(list)));
        }
        importSearchPaths = Collections.unmodifiableMap(paths);
    }

    public static Builder builder(String toolsVersion) {
        return new Builder(toolsVersion);
    }

    public Optional<SubToolset> subToolset(String version) {
        return version == null ? Optional.empty() : Optional.ofNullable(subToolsets.get(version));
    }

    /** Search paths declared for an OS key; empty when none. */
    public List<ProjectImportSearchPaths> searchPaths(String os) {
        return importSearchPaths.getOrDefault(os.toLowerCase(Locale.ROOT), List.of());
    }

    /**
     * Search paths for a property on the current OS, if the toolset declares
     * any.
     */
    public Optional<ProjectImportSearchPaths> searchPathsFor(String propertyName) {
        for (ProjectImportSearchPaths p : searchPaths(currentOs())) {
            if (p.propertyName().equalsIgnoreCase(propertyName)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    /** The OS key for the running JVM. */
    public static String currentOs() {
        String name = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (name.startsWith("windows")) {
            return OS_WINDOWS;
        }
        if (name.startsWith("mac") || name.startsWith("darwin")) {
            return OS_OSX;
        }
        return OS_UNIX;
    }

    /** Builder for {@link Toolset}. */
    public static final class Builder {

        private final String toolsVersion;
        private Path toolsPath;
        private final Map<String, String> properties = new LinkedHashMap<>();
        private final Map<String, SubToolset> subToolsets = new LinkedHashMap<>();
        private String defaultSubToolsetVersion;
        private final Map<String, List<ProjectImportSearchPaths>> importSearchPaths = new LinkedHashMap<>();

        private Builder(String toolsVersion) {
            this.toolsVersion = toolsVersion;
        }

        public Builder toolsPath(Path value) {
            this.toolsPath = value;
            return this;
        }

        public Builder property(String name, String value) {
            properties.put(name, value);
            return this;
        }

        public Builder subToolset(SubToolset value) {
            subToolsets.put(value.version(), value);
            return this;
        }

        public Builder defaultSubToolsetVersion(String value) {
            this.defaultSubToolsetVersion = value;
            return this;
        }

        public Builder searchPaths(String os, String propertyName, List<String> paths) {
            importSearchPaths
                    .computeIfAbsent(os.toLowerCase(Locale.ROOT), k -> new ArrayList<>())
                    .add(new ProjectImportSearchPaths(propertyName, paths));
            return this;
        }

        public Toolset build() {
            return new Toolset(
                    toolsVersion, toolsPath, properties, subToolsets, defaultSubToolsetVersion, importSearchPaths);
        }
    }
}
