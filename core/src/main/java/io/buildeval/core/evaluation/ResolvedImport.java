package io.buildeval.core.evaluation;

import io.buildeval.core.construction.ImportElement;
import io.buildeval.core.construction.ProjectRootElement;
import io.buildeval.core.sdk.SdkReference;
import io.buildeval.core.spi.SdkResult;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One file an {@code <Import>} resolved to.
 *
 * @param importingElement the {@code <Import>} that pulled the file in
 * @param importedProject the parsed file
 * @param isImported {@code true} when the importing element lives outside the
 *     main project
 * @param sdkReference the SDK the path was resolved through, or {@code null}
 * @param sdkResult the resolver's answer for {@code sdkReference}, or
 *     {@code null}
 */
public record ResolvedImport(
        ImportElement importingElement,
        ProjectRootElement importedProject,
        boolean isImported,
        SdkReference sdkReference,
        SdkResult sdkResult) {

    public ResolvedImport {
        Objects.requireNonNull(importingElement, "importingElement must not be null");
        Objects.requireNonNull(importedProject, "importedProject must not be null");
    }

    public Path path() {
        return importedProject.fullPath();
    }

    @Override
    public String toString() {
        return importingElement.containingProject().fileName() + " -> " + path();
    }
}
