package io.elementschema.core.validation;

import io.elementschema.core.element.Element;

/**
 * Fails if the value does not look like an e-mail address: it needs an {@code @} followed by a
 * host containing a dot.
 *
 * <p>This accepts every valid address but does not reject every invalid one. Whether an address
 * is reachable can only be established by sending mail to it.
 */
public final class ProbablyAnEmailAddress extends Validator {

    public static final String KEY = "probably-an-email-address";
    public static final String MESSAGE = "Must be a valid e-mail address.";

    public ProbablyAnEmailAddress() {
        this(MESSAGE);
    }

    public ProbablyAnEmailAddress(String message) {
        super(KEY, message);
    }

    @Override
    public boolean validate(Element<?> element, ValidationContext context) {
        if (!isUnusable(element) && element.value().get() instanceof CharSequence text) {
            String value = text.toString();
            int at = value.indexOf('@');
            if (at >= 0) {
                String host = value.substring(at + 1);
                if (host.contains(".") && host.split("\\.", -1).length >= 2) {
                    return true;
                }
            }
        }
        noteError(element, context);
        return false;
    }
}
