package io.elementschema.core.validation;

import io.elementschema.core.element.Element;
import java.util.regex.Pattern;

/**
 * Fails if the value does not match {@code regex} at its start ({@link java.util.regex.Matcher#lookingAt()}
 * semantics, not a full match). Non-text values fail.
 */
public final class MatchesRegex extends Validator {

    public static final String KEY = "matches-regex";
    public static final String MESSAGE = "Must be a valid value.";

    private final Pattern regex;

    /** Matches every text value. */
    public MatchesRegex() {
        this("");
    }

    public MatchesRegex(String regex) {
        this(Pattern.compile(regex), MESSAGE);
    }

    public MatchesRegex(Pattern regex, String message) {
        super(KEY, message);
        this.regex = regex;
    }

    public Pattern regex() {
        return regex;
    }

    @Override
    public boolean validate(Element<?> element, ValidationContext context) {
        if (!isUnusable(element)
                && element.value().get() instanceof CharSequence text
                && regex.matcher(text).lookingAt()) {
            return true;
        }
        noteError(element, context);
        return false;
    }
}
