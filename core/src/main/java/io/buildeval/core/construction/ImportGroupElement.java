package io.buildeval.core.construction;

import java.util.List;
import java.util.Map;

/** An {@code <ImportGroup>}; children are imports only. */
public final class ImportGroupElement extends ProjectElementContainer {

    ImportGroupElement(Map<String, String> attributes, ElementLocation location) {
        super("ImportGroup", attributes, location);
    }

    public List<ImportElement> imports() {
        return childrenOfType(ImportElement.class);
    }
}
