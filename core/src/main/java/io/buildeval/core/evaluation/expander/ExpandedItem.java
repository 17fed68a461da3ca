package io.buildeval.core.evaluation.expander;

import io.buildeval.core.evaluation.EvaluatedItem;
import io.buildeval.core.evaluation.WellKnownMetadata;
import java.nio.file.Path;

/**
 * One result of expanding an item vector: an escaped include paired with the
 * item it was derived from. Transforms change the include but keep the source,
 * so custom metadata follows the source while well-known metadata reflects the
 * current include.
 *
 * @param includeEscaped the include after transforms
 * @param source the item it came from, or {@code null} for synthesised values
 *     such as a count
 * @param carriesMetadata {@code false} once metadata has been cleared
 */
public record ExpandedItem(String includeEscaped, EvaluatedItem source, boolean carriesMetadata) {

    static ExpandedItem of(EvaluatedItem item) {
        return new ExpandedItem(item.evaluatedIncludeEscaped(), item, true);
    }

    static ExpandedItem synthesised(String includeEscaped) {
        return new ExpandedItem(includeEscaped, null, false);
    }

    ExpandedItem withInclude(String newInclude) {
        return new ExpandedItem(newInclude, source, carriesMetadata);
    }

    /**
     * Escaped value of a well-known or custom metadata of this result.
     *
     * @param directory base for path metadata when the source does not provide
     *     one
     */
    String metadataValueEscaped(String name, Path directory) {
        if (WellKnownMetadata.isWellKnown(name)) {
            Path definingProject = source != null ? source.definingProject() : null;
            String recursiveDir = source != null ? source.getMetadataValueEscaped(WellKnownMetadata.RECURSIVE_DIR) : null;
            return WellKnownMetadata.compute(name, includeEscaped, directory, definingProject, recursiveDir);
        }
        if (source == null || !carriesMetadata) {
            return "";
        }
        return source.getMetadata(name).map(m -> m.evaluatedValueEscaped()).orElse("");
    }
}
