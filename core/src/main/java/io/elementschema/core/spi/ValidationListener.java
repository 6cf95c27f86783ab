package io.elementschema.core.spi;

import io.elementschema.core.element.ElementValue;
import java.util.List;

/**
 * SPI for observing validator invocations.
 *
 * <p>Embedding applications bridge this to their metrics or audit systems. The core has no
 * telemetry dependencies; this is a pure Java interface. It is supplied through
 * {@code ValidationContext}.
 *
 * <p>Exceptions thrown by listeners are caught and logged; they do NOT affect the validation
 * result.
 */
public interface ValidationListener {

    /** Listener that ignores every event. */
    ValidationListener NOOP = event -> {};

    /**
     * Called after a validator has checked an element.
     *
     * @param event contains the validator key, element type, context name, raw input, outcome and
     *              the element's errors at that point
     */
    void onValidated(ValidatorEvent event);

    /** Event emitted once per validator invocation. */
    record ValidatorEvent(
            String validator,
            String elementType,
            String contextName,
            ElementValue<Object> rawValue,
            boolean passed,
            List<String> errors) {

        /** Canonical constructor with defensive copy. */
        public ValidatorEvent {
            errors = errors != null ? List.copyOf(errors) : List.of();
        }
    }
}
