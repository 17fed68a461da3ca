package io.buildeval.core.toolset;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Property overlay applied on top of a toolset when the
 * {@code VisualStudioVersion} property selects it.
 *
 * @param version the selector value, e.g. {@code 17.0}
 * @param properties overlay properties in declaration order
 */
public record SubToolset(String version, Map<String, String> properties) {

    public SubToolset {
        Objects.requireNonNull(version, "version must not be null");
        properties = properties == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }
}
