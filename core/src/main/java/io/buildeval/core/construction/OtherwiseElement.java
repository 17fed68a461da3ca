package io.buildeval.core.construction;

import java.util.Map;

/** The fallback branch of a {@code <Choose>}. */
public final class OtherwiseElement extends ProjectElementContainer {

    OtherwiseElement(Map<String, String> attributes, ElementLocation location) {
        super("Otherwise", attributes, location);
    }
}
