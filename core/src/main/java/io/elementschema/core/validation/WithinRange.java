package io.elementschema.core.validation;

import io.elementschema.core.element.Element;
import java.util.Map;

/**
 * Fails unless {@code start < value < end}. Placeholders {@code {start}} and {@code {end}} are
 * substituted.
 */
public final class WithinRange extends Validator {

    public static final String KEY = "within-range";
    public static final String MESSAGE = "Must be greater than {start} and shorter than {end}.";

    private final Comparable<?> start;
    private final Comparable<?> end;

    public WithinRange(Comparable<?> start, Comparable<?> end) {
        this(start, end, MESSAGE);
    }

    public WithinRange(Comparable<?> start, Comparable<?> end, String message) {
        super(KEY, message);
        this.start = start;
        this.end = end;
    }

    @Override
    public boolean validate(Element<?> element, ValidationContext context) {
        if (!isUnusable(element)) {
            Object value = element.value().get();
            if (Values.compare(start, value) < 0 && Values.compare(value, end) < 0) {
                return true;
            }
        }
        noteError(element, message(), context, Map.of("start", start, "end", end));
        return false;
    }
}
