package io.elementschema.core.mapping;

import io.elementschema.core.element.Container;
import io.elementschema.core.element.Element;
import io.elementschema.core.element.ElementType;
import io.elementschema.core.element.ElementValue;
import io.elementschema.core.element.NamedChildren;
import io.elementschema.core.element.PathedElement;
import io.elementschema.core.element.Sentinel;
import io.elementschema.core.error.ElementSchemaException.Operation;
import io.elementschema.core.error.MissingKeyException;
import io.elementschema.core.validation.Validator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A mapping with a fixed set of named fields, each with its own element type, e.g. a sign-up form:
 *
 * <pre>{@code
 * ElementType<Form> signUp = Form.builder()
 *         .field("email", UnicodeElement.TYPE.validatedBy(new ProbablyAnEmailAddress()))
 *         .field("password", UnicodeElement.TYPE.validatedBy(new LongerThan(7)))
 *         .field("confirm", UnicodeElement.TYPE)
 *         .validatedBy(new AttributesEqual(Operand.of("Password", "password"), Operand.of("Confirmation", "confirm")))
 *         .build();
 * }</pre>
 *
 * <p>Raw input is a map (or {@link Mapping}); each field takes the entry with its name and fields
 * without an entry stay unspecified. Unknown entries are ignored. Field {@code i} (declaration
 * order) is traversed under {@code prefix + [i]}.
 */
public final class Form extends Container<Map<String, Object>> implements NamedChildren {

    private static final Logger LOG = LoggerFactory.getLogger(Form.class);

    private final Map<String, Element<?>> fields;
    private boolean malformed;

    private Form(Map<String, ElementType<?>> declared) {
        Map<String, Element<?>> created = new LinkedHashMap<>();
        declared.forEach((name, type) -> created.put(name, type.create()));
        this.fields = Collections.unmodifiableMap(created);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Records {@code raw} and hands each field its entry. Input that is not a map leaves every
     * field unspecified and makes the form's value {@code NOT_UNSERIALIZABLE}.
     */
    @Override
    public void set(Object raw) {
        super.set(raw);
        ElementValue<Object> stored = rawValue();
        malformed = false;
        if (stored.isUnspecified()) {
            fields.values().forEach(Element::unset);
            return;
        }
        Object input = stored.get();
        Optional<List<Map.Entry<Object, Object>>> pairs =
                input instanceof Map<?, ?> || input instanceof Mapping<?, ?> ? RawPairs.read(input) : Optional.empty();
        if (pairs.isEmpty()) {
            LOG.debug("Raw value is not a map: fields={}, type={}", fields.keySet(), MutableMapping.typeOf(input));
            malformed = true;
            fields.values().forEach(Element::unset);
            return;
        }
        Map<String, Object> byName = new LinkedHashMap<>();
        pairs.get().forEach(entry -> byName.put(String.valueOf(entry.getKey()), entry.getValue()));
        fields.forEach((name, field) -> {
            if (byName.containsKey(name)) {
                field.set(byName.get(name));
            } else {
                field.unset();
            }
        });
    }

    /**
     * An insertion-ordered map of field name to field value; {@code UNSPECIFIED} if the form has
     * no raw input and no field has input; {@code NOT_UNSERIALIZABLE} if the raw input was not a map
     * or any field did not coerce. Unspecified fields map to {@code null}, so an empty map yields a
     * map of nulls.
     */
    @Override
    public ElementValue<Map<String, Object>> value() {
        if (malformed) {
            return ElementValue.notUnserializable();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        boolean anySpecified = false;
        for (Map.Entry<String, Element<?>> field : fields.entrySet()) {
            ElementValue<?> value = field.getValue().value();
            if (value.isNotUnserializable()) {
                return ElementValue.notUnserializable();
            }
            anySpecified |= !value.isUnspecified();
            result.put(field.getKey(), value.orElse(null));
        }
        return anySpecified || rawValue().isPresent() ? ElementValue.of(result) : ElementValue.unspecified();
    }

    /**
     * The field element named {@code name}.
     *
     * @throws MissingKeyException if the form declares no such field
     */
    public Element<?> field(String name) {
        Element<?> field = fields.get(name);
        if (field == null) {
            throw new MissingKeyException(name, Operation.FIELD);
        }
        return field;
    }

    /** Field names in declaration order. */
    public List<String> fieldNames() {
        return List.copyOf(fields.keySet());
    }

    @Override
    public Optional<Element<?>> child(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    @Override
    public int size() {
        return fields.size();
    }

    /** Unsets every field; the fields themselves are fixed. */
    @Override
    public void clear() {
        super.set(Sentinel.UNSPECIFIED);
        malformed = false;
        fields.values().forEach(Element::unset);
    }

    @Override
    protected Stream<Element<?>> children() {
        return new ArrayList<>(fields.values()).stream();
    }

    @Override
    public Stream<PathedElement> traverse(List<Integer> prefix) {
        List<Element<?>> ordered = new ArrayList<>(fields.values());
        return IntStream.range(0, ordered.size()).boxed().flatMap(i -> {
            List<Integer> path = new ArrayList<>(prefix);
            path.add(i);
            return ordered.get(i).traverse(path);
        });
    }

    /** Declares the fields and form-level validators of a form type. */
    public static final class Builder {

        private final Map<String, ElementType<?>> fields = new LinkedHashMap<>();
        private final List<Validator> validators = new ArrayList<>();

        Builder() {}

        /** Adds a field; a repeated name replaces the earlier type but keeps its position. */
        public Builder field(String name, ElementType<?> type) {
            Objects.requireNonNull(name, "name must not be null");
            fields.put(name, Objects.requireNonNull(type, "type must not be null"));
            return this;
        }

        /** Validators run on the whole form after its fields. */
        public Builder validatedBy(Validator... added) {
            validators.addAll(List.of(added));
            return this;
        }

        /** Builds an immutable form type. */
        public ElementType<Form> build() {
            Map<String, ElementType<?>> declared = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
            ElementType<Form> type = () -> new Form(declared);
            Validator[] attached = validators.toArray(new Validator[0]);
            return attached.length == 0 ? type : type.validatedBy(attached);
        }
    }
}
