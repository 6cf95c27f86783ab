package io.elementschema.core.element;

/**
 * Markers standing in for a value that is not there.
 *
 * <ul>
 * <li>{@link #UNSPECIFIED}: no raw input was ever supplied for the element.</li>
 * <li>{@link #NOT_UNSERIALIZABLE}: raw input was supplied but could not be converted into the
 * element's target shape.</li>
 * </ul>
 *
 * <p>Passing {@code UNSPECIFIED} as raw input to {@link Element#set(Object)} resets the element.
 */
public enum Sentinel {
    UNSPECIFIED,
    NOT_UNSERIALIZABLE
}
