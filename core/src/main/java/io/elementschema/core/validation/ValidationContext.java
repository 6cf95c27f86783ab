package io.elementschema.core.validation;

import io.elementschema.core.config.MessageCatalog;
import io.elementschema.core.spi.ValidationListener;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration threaded unchanged through a validation pass.
 *
 * @param name       display name of the element being validated, used in diagnostics
 * @param attributes free-form values for custom validators
 * @param messages   message template overrides
 * @param listener   observability hook notified after every validator invocation
 */
public record ValidationContext(
        String name, Map<String, Object> attributes, MessageCatalog messages, ValidationListener listener) {

    public static final String DEFAULT_NAME = "unnamed";

    private static final ValidationContext EMPTY = new ValidationContext(null, null, null, null);

    /** Canonical constructor with defaults and defensive copies. */
    public ValidationContext {
        name = name != null ? name : DEFAULT_NAME;
        attributes = attributes != null ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes)) : Map.of();
        messages = messages != null ? messages : MessageCatalog.empty();
        listener = listener != null ? listener : ValidationListener.NOOP;
    }

    /** A context with default name, no attributes, no overrides and no listener. */
    public static ValidationContext empty() {
        return EMPTY;
    }

    /** A context carrying only a display name. */
    public static ValidationContext named(String name) {
        return new ValidationContext(name, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Looks up a free-form attribute, or {@code null}. */
    public Object attribute(String key) {
        return attributes.get(key);
    }

    /** Builder for {@link ValidationContext}. */
    public static final class Builder {

        private String name;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private MessageCatalog messages;
        private ValidationListener listener;

        Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder attribute(String key, Object value) {
            attributes.put(key, value);
            return this;
        }

        public Builder messages(MessageCatalog messages) {
            this.messages = messages;
            return this;
        }

        public Builder listener(ValidationListener listener) {
            this.listener = listener;
            return this;
        }

        public ValidationContext build() {
            return new ValidationContext(name, attributes, messages, listener);
        }
    }
}
