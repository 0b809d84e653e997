package com.compid.core.id;

/**
 * One field of an identifier: the delimiter emitted in front of it and its value.
 *
 * @param delimiter leading delimiter, empty for the first fields
 * @param value field value, {@code null} or empty when absent
 */
public record IdElement(String delimiter, String value) {

    public IdElement {
        delimiter = delimiter == null ? "" : delimiter;
    }

    public static IdElement of(String delimiter, String value) {
        return new IdElement(delimiter, value);
    }

    public boolean isPresent() {
        return value != null && !value.isEmpty();
    }
}
