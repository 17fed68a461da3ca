package io.buildeval.core.construction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of the parsed project tree. Every element exposes its XML name, its
 * attributes in document order, its condition, its source location and the
 * project file that physically contains it.
 *
 * <p>
 * Trees are immutable once parsed and may be shared between concurrent
 * evaluations.
 */
public abstract class ProjectElement {

    static final String CONDITION = "Condition";

    private final String elementName;
    private final Map<String, String> attributes;
    private final ElementLocation location;
    private ProjectElementContainer parent;

    protected ProjectElement(String elementName, Map<String, String> attributes, ElementLocation location) {
        this.elementName = elementName;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.location = location;
    }

    /** XML local name of this element. */
    public String elementName() {
        return elementName;
    }

    /** Attributes in document order. */
    public Map<String, String> attributes() {
        return attributes;
    }

    /** Attribute value, or the empty string when absent. */
    public String attribute(String name) {
        String value = attributes.get(name);
        return value != null ? value : "";
    }

    public boolean hasAttribute(String name) {
        return attributes.containsKey(name);
    }

    /** The unevaluated condition, empty when the element has none. */
    public String condition() {
        return attribute(CONDITION);
    }

    public ElementLocation location() {
        return location;
    }

    /** The enclosing element, or {@code null} for the project root. */
    public ProjectElementContainer parent() {
        return parent;
    }

    void setParent(ProjectElementContainer parent) {
        this.parent = parent;
    }

    /** The project file this element is physically written in. */
    public ProjectRootElement containingProject() {
        ProjectElement current = this;
        while (current.parent != null) {
            current = current.parent;
        }
        return (ProjectRootElement) current;
    }

    /**
     * Returns {@code true} when this element sits somewhere beneath a
     * {@code <Target>}.
     */
    public boolean isInsideTarget() {
        for (ProjectElementContainer p = parent; p != null; p = p.parent()) {
            if (p instanceof TargetElement) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "<" + elementName + "> at " + location;
    }
}
