package io.buildeval.core.toolset;

import java.util.List;
import java.util.Objects;

/**
 * Fallback directories for imports that reference {@code $(propertyName)}.
 * Entries may themselves contain property references; they are expanded when an
 * import is resolved.
 */
public record ProjectImportSearchPaths(String propertyName, List<String> searchPaths) {

    public ProjectImportSearchPaths {
        Objects.requireNonNull(propertyName, "propertyName must not be null");
        searchPaths = searchPaths == null ? List.of() : List.copyOf(searchPaths);
    }
}
