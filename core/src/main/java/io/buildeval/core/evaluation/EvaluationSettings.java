package io.buildeval.core.evaluation;

import io.buildeval.core.cache.ProjectRootElementCache;
import io.buildeval.core.error.InvalidConfigurationException;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Switches that apply to every evaluation in a project collection. Immutable.
 *
 * @param loadSettings import loading relaxations
 * @param warnOnUninitializedProperty report reads of properties before their
 *     first assignment
 * @param itemNameCaseSensitivity how item type names are compared
 * @param propertyTracking property events forwarded to the listener
 * @param logImports raise import resolved / ignored events
 * @param cacheSize strongly held entries in the project root element cache
 */
public record EvaluationSettings(
        Set<LoadSetting> loadSettings,
        boolean warnOnUninitializedProperty,
        ItemNameCaseSensitivity itemNameCaseSensitivity,
        Set<PropertyTracking> propertyTracking,
        boolean logImports,
        int cacheSize) {

    public static final String ENV_WARN_ON_UNINITIALIZED = "MSBUILDWARNONUNINITIALIZEDPROPERTY";
    public static final String ENV_CASE_SENSITIVE_ITEM_NAMES = "MSBUILDUSECASESENSITIVEITEMNAMES";
    public static final String ENV_PROPERTY_TRACKING = "MsBuildLogPropertyTracking";
    public static final String ENV_LOG_IMPORTS = "MSBUILDLOGIMPORTS";
    public static final String ENV_CACHE_SIZE = "MSBUILDPROJECTROOTELEMENTCACHESIZE";

    /** Settings with every switch off. */
    public static final EvaluationSettings DEFAULT = builder().build();

    public EvaluationSettings {
        loadSettings = loadSettings == null || loadSettings.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(loadSettings));
        propertyTracking = propertyTracking == null || propertyTracking.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(propertyTracking));
        itemNameCaseSensitivity = Objects.requireNonNullElse(
                itemNameCaseSensitivity, ItemNameCaseSensitivity.CASE_INSENSITIVE);
        if (cacheSize < 0) {
            throw new IllegalArgumentException("cacheSize must not be negative: " + cacheSize);
        }
    }

    public boolean has(LoadSetting setting) {
        return loadSettings.contains(setting);
    }

    public boolean tracks(PropertyTracking tracking) {
        return propertyTracking.contains(tracking);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Settings from the process environment. */
    public static EvaluationSettings fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Settings from environment variables. A variable counts as set when it is
     * non-blank; the tracking and cache size variables must be integers.
     *
     * @throws InvalidConfigurationException when a numeric variable cannot be
     *     parsed
     */
    public static EvaluationSettings fromEnvironment(Function<String, String> envLookup) {
        Builder builder = builder()
                .warnOnUninitializedProperty(isSet(envLookup, ENV_WARN_ON_UNINITIALIZED))
                .logImports(isSet(envLookup, ENV_LOG_IMPORTS));
        if (isSet(envLookup, ENV_CASE_SENSITIVE_ITEM_NAMES)) {
            builder.itemNameCaseSensitivity(ItemNameCaseSensitivity.CASE_SENSITIVE);
        }
        if (isSet(envLookup, ENV_PROPERTY_TRACKING)) {
            builder.propertyTracking(PropertyTracking.fromFlags(intValue(envLookup, ENV_PROPERTY_TRACKING)));
        }
        if (isSet(envLookup, ENV_CACHE_SIZE)) {
            builder.cacheSize(intValue(envLookup, ENV_CACHE_SIZE));
        }
        return builder.build();
    }

    private static boolean isSet(Function<String, String> envLookup, String name) {
        String value = envLookup.apply(name);
        return value != null && !value.isBlank();
    }

    private static int intValue(Function<String, String> envLookup, String name) {
        String value = envLookup.apply(name).trim();
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException(
                    "Environment variable " + name + " must be an integer but was '" + value + "'", e, "MSB1001", null);
        }
    }

    public static final class Builder {
        private final Set<LoadSetting> loadSettings = EnumSet.noneOf(LoadSetting.class);
        private boolean warnOnUninitializedProperty;
        private ItemNameCaseSensitivity itemNameCaseSensitivity = ItemNameCaseSensitivity.CASE_INSENSITIVE;
        private final Set<PropertyTracking> propertyTracking = EnumSet.noneOf(PropertyTracking.class);
        private boolean logImports;
        private int cacheSize = ProjectRootElementCache.DEFAULT_CAPACITY;

        private Builder() {}

        public Builder loadSetting(LoadSetting value) {
            loadSettings.add(value);
            return this;
        }

        public Builder loadSettings(Set<LoadSetting> values) {
            loadSettings.addAll(values);
            return this;
        }

        public Builder warnOnUninitializedProperty(boolean value) {
            this.warnOnUninitializedProperty = value;
            return this;
        }

        public Builder itemNameCaseSensitivity(ItemNameCaseSensitivity value) {
            this.itemNameCaseSensitivity = value;
            return this;
        }

        public Builder propertyTracking(Set<PropertyTracking> values) {
            propertyTracking.addAll(values);
            return this;
        }

        public Builder logImports(boolean value) {
            this.logImports = value;
            return this;
        }

        public Builder cacheSize(int value) {
            this.cacheSize = value;
            return this;
        }

        public EvaluationSettings build() {
            return new EvaluationSettings(
                    loadSettings, warnOnUninitializedProperty, itemNameCaseSensitivity, propertyTracking, logImports, cacheSize);
        }
    }
}
