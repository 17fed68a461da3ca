package io.buildeval.core.construction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** A project element with child elements. */
public abstract class ProjectElementContainer extends ProjectElement {

    private final List<ProjectElement> children = new ArrayList<>();

    protected ProjectElementContainer(String elementName, Map<String, String> attributes, ElementLocation location) {
        super(elementName, attributes, location);
    }

    void addChild(ProjectElement child) {
        child.setParent(this);
        children.add(child);
    }

    /** Children in document order. */
    public List<ProjectElement> children() {
        return Collections.unmodifiableList(children);
    }

    /** Children of the given type, in document order. */
    public <T extends ProjectElement> List<T> childrenOfType(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (ProjectElement child : children) {
            if (type.isInstance(child)) {
                result.add(type.cast(child));
            }
        }
        return result;
    }
}
