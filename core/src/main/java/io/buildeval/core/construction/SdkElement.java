package io.buildeval.core.construction;

import java.util.Map;

/**
 * An {@code <Sdk Name=".." Version=".." MinimumVersion=".."/>} element directly
 * under the project.
 */
public final class SdkElement extends ProjectElement {

    SdkElement(Map<String, String> attributes, ElementLocation location) {
        super("Sdk", attributes, location);
    }

    public String name() {
        return attribute("Name");
    }

    public String version() {
        return attribute("Version");
    }

    public String minimumVersion() {
        return attribute("MinimumVersion");
    }
}
