package io.buildeval.core.sdk;

import io.buildeval.core.construction.ElementLocation;
import io.buildeval.core.error.InvalidConfigurationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A reference to an SDK by name with an optional exact version or minimum
 * version.
 *
 * @param name SDK name, never blank
 * @param version requested version, or {@code null}
 * @param minimumVersion requested minimum version, or {@code null}
 */
public record SdkReference(String name, String version, String minimumVersion) {

    public static final String INVALID_FORMAT_CODE = "MSB4229";

    private static final String MIN_PREFIX = "min=";

    public SdkReference {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        version = blankToNull(version);
        minimumVersion = blankToNull(minimumVersion);
    }

    /**
     * Parses {@code Name}, {@code Name/Version} or {@code Name/min=Version}.
     */
    public static SdkReference parse(String text) {
        return parse(text, null);
    }

    /**
     * Parses a single SDK reference.
     *
     * @throws InvalidConfigurationException if the name is empty or there is
     *     more than one '/'
     */
    public static SdkReference parse(String text, ElementLocation location) {
        String trimmed = text == null ? "" : text.trim();
        String[] parts = trimmed.split("/", -1);
        if (trimmed.isEmpty() || parts.length > 2 || parts[0].isBlank()) {
            throw new InvalidConfigurationException(
                    "The SDK reference \"" + text + "\" is not valid. Use \"Name\", \"Name/Version\" or"
                            + " \"Name/min=Version\".",
                    INVALID_FORMAT_CODE,
                    location);
        }
        String name = parts[0].trim();
        if (parts.length == 1) {
            return new SdkReference(name, null, null);
        }
        String versionPart = parts[1].trim();
        if (versionPart.regionMatches(true, 0, MIN_PREFIX, 0, MIN_PREFIX.length())) {
            return new SdkReference(name, null, versionPart.substring(MIN_PREFIX.length()).trim());
        }
        return new SdkReference(name, versionPart, null);
    }

    /** Parses a ';'-separated list of references, ignoring blank entries. */
    public static List<SdkReference> parseList(String text, ElementLocation location) {
        List<SdkReference> result = new ArrayList<>();
        if (text == null) {
            return result;
        }
        for (String entry : text.split(";")) {
            if (!entry.isBlank()) {
                result.add(parse(entry, location));
            }
        }
        return result;
    }

    /**
     * Returns {@code true} when a resolved version satisfies this reference's
     * exact version. A reference without a version matches anything; otherwise
     * the comparison is a case-insensitive string comparison, so {@code 1.0}
     * and {@code 1.0.0} differ.
     */
    public boolean isSameVersion(String resolvedVersion) {
        return version == null || version.equalsIgnoreCase(resolvedVersion);
    }

    @Override
    public String toString() {
        if (version != null) {
            return name + "/" + version;
        }
        if (minimumVersion != null) {
            return name + "/" + MIN_PREFIX + minimumVersion;
        }
        return name;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
