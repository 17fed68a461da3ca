package io.buildeval.core.construction;

import java.util.Map;

/** A task invocation or other opaque element inside a target body. */
public final class TaskElement extends ProjectElement {

    TaskElement(String name, Map<String, String> attributes, ElementLocation location) {
        super(name, attributes, location);
    }
}
