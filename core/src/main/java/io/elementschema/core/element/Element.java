package io.elementschema.core.element;

import io.elementschema.core.validation.ValidationContext;
import io.elementschema.core.validation.Validator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * A schema-typed node: holds raw input, derives a coerced value from it on demand, and carries
 * validation state.
 *
 * <p>An element is owned by exactly one parent container (or by the caller, for a root). Children
 * hold no reference to their parent.
 *
 * <p>Not thread-safe.
 *
 * @param <T> the type of the coerced value
 */
public abstract class Element<T> {

    private ElementValue<Object> rawValue = ElementValue.unspecified();
    private final List<String> errors = new ArrayList<>();
    private final List<Validator> validators = new ArrayList<>();
    private Boolean valid;

    protected Element() {}

    /**
     * Records raw input. {@link Sentinel#UNSPECIFIED} (or an unspecified {@link ElementValue})
     * resets the element; a present {@link ElementValue} is unwrapped.
     */
    public void set(Object raw) {
        rawValue = toRawValue(raw);
    }

    /** Resets the element to having no raw input. */
    public void unset() {
        set(Sentinel.UNSPECIFIED);
    }

    public ElementValue<Object> rawValue() {
        return rawValue;
    }

    /** Replaces the stored raw value without any further processing. */
    protected final void setRawValue(ElementValue<Object> rawValue) {
        this.rawValue = rawValue;
    }

    /** The coerced value, computed from the current state on every call. */
    public abstract ElementValue<T> value();

    /** Mutable list of error messages recorded by validators, in order. */
    public List<String> errors() {
        return errors;
    }

    public void clearErrors() {
        errors.clear();
    }

    /** Result of the last {@link #validate} run, or {@code null} if it never ran. */
    public Boolean isValid() {
        return valid;
    }

    protected final void setValid(Boolean valid) {
        this.valid = valid;
    }

    public List<Validator> validators() {
        return Collections.unmodifiableList(validators);
    }

    void attachValidators(List<Validator> added) {
        validators.addAll(added);
    }

    /**
     * Runs every attached validator, without short-circuiting, and records the conjunction as
     * {@link #isValid()}. Errors from earlier runs are kept; call {@link #clearErrors()} first to
     * start from an empty list.
     *
     * @param context threaded unchanged to every validator; {@code null} means
     *                {@link ValidationContext#empty()}
     * @return the new validity
     */
    public boolean validate(ValidationContext context) {
        boolean result = runValidators(context != null ? context : ValidationContext.empty());
        setValid(result);
        return result;
    }

    public boolean validate() {
        return validate(ValidationContext.empty());
    }

    protected final boolean runValidators(ValidationContext context) {
        boolean result = true;
        for (Validator validator : validators) {
            result &= validator.apply(this, context);
        }
        return result;
    }

    /**
     * Lazily yields the leaf elements below this one, each tagged with its path. A plain element
     * is its own only leaf.
     */
    public Stream<PathedElement> traverse(List<Integer> prefix) {
        return Stream.of(new PathedElement(prefix, this));
    }

    public Stream<PathedElement> traverse() {
        return traverse(List.of());
    }

    /** Name used in log lines and listener events. */
    public String typeName() {
        return getClass().getSimpleName();
    }

    private static ElementValue<Object> toRawValue(Object raw) {
        if (raw == Sentinel.UNSPECIFIED) {
            return ElementValue.unspecified();
        }
        if (raw instanceof ElementValue<?> wrapped) {
            if (wrapped.isUnspecified()) {
                return ElementValue.unspecified();
            }
            if (wrapped.isPresent()) {
                return ElementValue.of(wrapped.get());
            }
        }
        return ElementValue.of(raw);
    }

    @Override
    public String toString() {
        return typeName() + "[raw=" + rawValue + ", valid=" + valid + "]";
    }
}
