package io.elementschema.core.element;

import java.util.List;
import java.util.Objects;

/**
 * A leaf element yielded by {@link Element#traverse(List)}, tagged with its structural path.
 *
 * @param path    indices locating the element below the traversal root
 * @param element the leaf element
 */
public record PathedElement(List<Integer> path, Element<?> element) {

    /** Canonical constructor with defensive copy. */
    public PathedElement {
        path = List.copyOf(path);
        Objects.requireNonNull(element, "element must not be null");
    }
}
