package io.elementschema.core.validation;

import io.elementschema.core.element.Element;
import io.elementschema.core.spi.ValidationListener.ValidatorEvent;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks one element against one rule.
 *
 * <p>Subclasses override {@link #validate}; the base implementation always fails. A failing
 * validator records a message through {@link #noteError} and returns {@code false}. It never
 * throws because the data was bad: exceptions are reserved for a schema that applies a validator
 * to a value it cannot handle.
 *
 * <p>Validators are immutable and may be shared by any number of element types.
 */
public abstract class Validator {

    private static final Logger LOG = LoggerFactory.getLogger(Validator.class);

    private final String key;
    private final String message;

    /**
     * @param key     stable identifier, used for message catalog lookups and in events
     * @param message the default message template
     */
    protected Validator(String key, String message) {
        this.key = key;
        this.message = message;
    }

    /** Identifier of this validator, e.g. {@code shorter-than}. */
    public String key() {
        return key;
    }

    /** The default message template. */
    public String message() {
        return message;
    }

    /**
     * Checks the element.
     *
     * @return {@code true} if the element passes
     */
    public boolean validate(Element<?> element, ValidationContext context) {
        return false;
    }

    /** True if the element's value is a sentinel and no business rule can be checked. */
    public boolean isUnusable(Element<?> element) {
        return element.value().isUnusable();
    }

    /**
     * Appends a message to the element's errors. {@code {name}} placeholders are replaced by the
     * matching substitution. A template registered for this validator's key in the context's
     * message catalog takes precedence over {@code template}. Messages are not de-duplicated.
     */
    public void noteError(
            Element<?> element, String template, ValidationContext context, Map<String, ?> substitutions) {
        String effective = context.messages().resolve(key, template);
        element.errors().add(substitute(effective, substitutions));
    }

    /** Appends the default message without substitutions. */
    public void noteError(Element<?> element, ValidationContext context) {
        noteError(element, message, context, Map.of());
    }

    /**
     * Runs {@link #validate}, then reports the outcome to the debug log and to the context's
     * listener. This is how elements invoke their validators.
     */
    public final boolean apply(Element<?> element, ValidationContext context) {
        boolean result = validate(element, context);
        if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "validate: element={}, name={}, raw={}, validator={}, passed={}, errors={}",
                    element.typeName(),
                    context.name(),
                    element.rawValue(),
                    key,
                    result,
                    element.errors());
        }
        try {
            context.listener()
                    .onValidated(new ValidatorEvent(
                            key, element.typeName(), context.name(), element.rawValue(), result, element.errors()));
        } catch (RuntimeException e) {
            LOG.warn("ValidationListener.onValidated failed", e);
        }
        return result;
    }

    static String substitute(String template, Map<String, ?> substitutions) {
        String result = template;
        for (Map.Entry<String, ?> entry : substitutions.entrySet()) {
            result = result.replace("{" + entry.getKey() + "}", String.valueOf(entry.getValue()));
        }
        return result;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + key + "]";
    }
}
