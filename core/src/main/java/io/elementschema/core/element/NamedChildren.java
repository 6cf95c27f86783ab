package io.elementschema.core.element;

import java.util.Optional;

/** An element whose children can be addressed by name. */
public interface NamedChildren {

    /** The child element registered under {@code name}, if any. */
    Optional<Element<?>> child(String name);
}
