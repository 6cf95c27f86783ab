package io.elementschema.core.validation;

import io.elementschema.core.element.Element;
import java.net.URI;
import java.net.URISyntaxException;

/** Fails if the value is not an absolute URL, i.e. lacks a scheme or a network location. */
public final class IsUrl extends Validator {

    public static final String KEY = "is-url";
    public static final String MESSAGE = "Must be a URL.";

    public IsUrl() {
        this(MESSAGE);
    }

    public IsUrl(String message) {
        super(KEY, message);
    }

    @Override
    public boolean validate(Element<?> element, ValidationContext context) {
        if (!isUnusable(element) && element.value().get() instanceof CharSequence text && isAbsolute(text)) {
            return true;
        }
        noteError(element, context);
        return false;
    }

    private static boolean isAbsolute(CharSequence text) {
        try {
            URI uri = new URI(text.toString());
            return notEmpty(uri.getScheme()) && notEmpty(uri.getRawAuthority());
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static boolean notEmpty(String s) {
        return s != null && !s.isEmpty();
    }
}
