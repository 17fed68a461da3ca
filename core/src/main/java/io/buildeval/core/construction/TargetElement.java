package io.buildeval.core.construction;

import java.util.Map;

/**
 * A {@code <Target>}. The evaluator only reads its name, condition and
 * dependency attributes; the body (property groups, item groups and tasks) is
 * kept for callers that execute targets.
 */
public final class TargetElement extends ProjectElementContainer {

    TargetElement(Map<String, String> attributes, ElementLocation location) {
        super("Target", attributes, location);
    }

    public String name() {
        return attribute("Name");
    }

    public String dependsOnTargets() {
        return attribute("DependsOnTargets");
    }

    public String beforeTargets() {
        return attribute("BeforeTargets");
    }

    public String afterTargets() {
        return attribute("AfterTargets");
    }

    public String inputs() {
        return attribute("Inputs");
    }

    public String outputs() {
        return attribute("Outputs");
    }

    public String returns() {
        return attribute("Returns");
    }
}
