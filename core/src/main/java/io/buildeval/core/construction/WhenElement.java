package io.buildeval.core.construction;

import java.util.Map;

/** A conditional branch of a {@code <Choose>}. */
public final class WhenElement extends ProjectElementContainer {

    WhenElement(Map<String, String> attributes, ElementLocation location) {
        super("When", attributes, location);
    }
}
