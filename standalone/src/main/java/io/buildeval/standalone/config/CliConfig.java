package io.buildeval.standalone.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration of one command-line evaluation.
 *
 * @param project project file to evaluate; required
 * @param toolsetFile YAML toolset definitions, or {@code null} for the built-in
 *     toolset
 * @param toolsVersion tools version overriding the project's, or {@code null}
 * @param globalProperties global properties, in declaration order
 * @param sdkRoots directories searched for SDKs, one sub-directory per SDK name
 * @param loadSettings names of {@code LoadSetting} constants to enable
 * @param warnOnUninitializedProperty report properties read before their first
 *     assignment
 * @param caseSensitiveItemNames compare item types case-sensitively
 * @param propertyTracking property tracking bit flags (1, 2, 4, 8)
 * @param logImports report resolved imports and false import conditions
 * @param includeEnvironment include environment-derived properties in the
 *     output
 * @param prettyPrint indent the JSON output
 * @param loggingFormat json or text
 * @param loggingLevel root log level
 */
public record CliConfig(
        String project,
        String toolsetFile,
        String toolsVersion,
        Map<String, String> globalProperties,
        List<String> sdkRoots,
        List<String> loadSettings,
        boolean warnOnUninitializedProperty,
        boolean caseSensitiveItemNames,
        int propertyTracking,
        boolean logImports,
        boolean includeEnvironment,
        boolean prettyPrint,
        String loggingFormat,
        String loggingLevel) {

    public CliConfig {
        globalProperties = Collections.unmodifiableMap(new LinkedHashMap<>(globalProperties));
        sdkRoots = List.copyOf(sdkRoots);
        loadSettings = List.copyOf(loadSettings);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link CliConfig}. Every field but {@code project} has a
     * default.
     */
    public static final class Builder {
        private String project;
        private String toolsetFile;
        private String toolsVersion;
        private final Map<String, String> globalProperties = new LinkedHashMap<>();
        private final List<String> sdkRoots = new ArrayList<>();
        private final List<String> loadSettings = new ArrayList<>();
        private boolean warnOnUninitializedProperty;
        private boolean caseSensitiveItemNames;
        private int propertyTracking;
        private boolean logImports;
        private boolean includeEnvironment;
        private boolean prettyPrint = true;
        private String loggingFormat = "text";
        private String loggingLevel = "WARN";

        private Builder() {}

        public Builder project(String value) {
            this.project = value;
            return this;
        }

        public Builder toolsetFile(String value) {
            this.toolsetFile = value;
            return this;
        }

        public Builder toolsVersion(String value) {
            this.toolsVersion = value;
            return this;
        }

        public Builder globalProperty(String name, String value) {
            globalProperties.put(name, value);
            return this;
        }

        public Builder sdkRoot(String value) {
            sdkRoots.add(value);
            return this;
        }

        public Builder loadSetting(String value) {
            loadSettings.add(value);
            return this;
        }

        public Builder warnOnUninitializedProperty(boolean value) {
            this.warnOnUninitializedProperty = value;
            return this;
        }

        public Builder caseSensitiveItemNames(boolean value) {
            this.caseSensitiveItemNames = value;
            return this;
        }

        public Builder propertyTracking(int value) {
            this.propertyTracking = value;
            return this;
        }

        public Builder logImports(boolean value) {
            this.logImports = value;
            return this;
        }

        public Builder includeEnvironment(boolean value) {
            this.includeEnvironment = value;
            return this;
        }

        public Builder prettyPrint(boolean value) {
            this.prettyPrint = value;
            return this;
        }

        public Builder loggingFormat(String value) {
            this.loggingFormat = value;
            return this;
        }

        public Builder loggingLevel(String value) {
            this.loggingLevel = value;
            return this;
        }

        /**
         * @throws ConfigLoadException when no project was configured
         */
        public CliConfig build() {
            if (project == null || project.isBlank()) {
                throw new ConfigLoadException(
                        "No project file configured. Use --project <path> or set project in the configuration file.");
            }
            return new CliConfig(
                    project,
                    toolsetFile,
                    toolsVersion,
                    globalProperties,
                    sdkRoots,
                    loadSettings,
                    warnOnUninitializedProperty,
                    caseSensitiveItemNames,
                    propertyTracking,
                    logImports,
                    includeEnvironment,
                    prettyPrint,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
