package io.buildeval.core.construction;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A {@code <Choose>}: one or more {@code <When>} and an optional trailing
 * {@code <Otherwise>}.
 */
public final class ChooseElement extends ProjectElementContainer {

    ChooseElement(Map<String, String> attributes, ElementLocation location) {
        super("Choose", attributes, location);
    }

    public List<WhenElement> whens() {
        return childrenOfType(WhenElement.class);
    }

    public Optional<OtherwiseElement> otherwise() {
        return childrenOfType(OtherwiseElement.class).stream().findFirst();
    }
}
