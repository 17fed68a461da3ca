package io.buildeval.core.evaluation;

import io.buildeval.core.construction.TargetElement;
import java.nio.file.Path;

/**
 * A target as seen after evaluation: the last definition of each name wins.
 * Attribute values are left unevaluated because they are only expanded when the
 * target runs.
 */
public record EvaluatedTarget(String name, TargetElement xml, boolean isImported) {

    public Path definingProject() {
        return xml.containingProject().fullPath();
    }

    public String dependsOnTargets() {
        return xml.dependsOnTargets();
    }

    public String beforeTargets() {
        return xml.beforeTargets();
    }

    public String afterTargets() {
        return xml.afterTargets();
    }
}
