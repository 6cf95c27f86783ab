package io.elementschema.core.validation;

import io.elementschema.core.element.Element;
import java.util.Map;

/**
 * Fails unless {@code start < length < end}. Placeholders {@code {start}} and {@code {end}} are
 * substituted.
 */
public final class LengthWithinRange extends Validator {

    public static final String KEY = "length-within-range";
    public static final String MESSAGE = "Must be longer than {start} and shorter than {end}.";

    private final int start;
    private final int end;

    public LengthWithinRange(int start, int end) {
        this(start, end, MESSAGE);
    }

    public LengthWithinRange(int start, int end, String message) {
        super(KEY, message);
        this.start = start;
        this.end = end;
    }

    @Override
    public boolean validate(Element<?> element, ValidationContext context) {
        if (!isUnusable(element)) {
            int length = Values.length(element.value().get());
            if (start < length && length < end) {
                return true;
            }
        }
        noteError(element, message(), context, Map.of("start", start, "end", end));
        return false;
    }
}
