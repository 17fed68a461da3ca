package io.buildeval.core.construction;

import java.util.Map;

/**
 * An {@code <Import>}. Implicit imports are synthesised for the project
 * {@code Sdk} attribute and for {@code <Sdk>} elements; they carry the location
 * of the element that declared the SDK.
 */
public final class ImportElement extends ProjectElement {

    private final boolean implicit;

    ImportElement(Map<String, String> attributes, ElementLocation location, boolean implicit) {
        super("Import", attributes, location);
        this.implicit = implicit;
    }

    /** Unevaluated {@code Project} attribute. */
    public String project() {
        return attribute("Project");
    }

    /** {@code Sdk} attribute, empty for plain file imports. */
    public String sdk() {
        return attribute("Sdk");
    }

    public String version() {
        return attribute("Version");
    }

    public String minimumVersion() {
        return attribute("MinimumVersion");
    }

    public boolean isSdkImport() {
        return !sdk().isBlank();
    }

    public boolean isImplicit() {
        return implicit;
    }
}
