package com.compid.core.util;

/**
 * Splitting helpers keyed on the last occurrence of a delimiter.
 */
public final class DelimiterUtils {

    private DelimiterUtils() {
        // Utility class
    }

    /**
     * Returns the text before the last {@code delimiter}, or the whole string if the
     * delimiter does not occur.
     *
     * @param value input string
     * @param delimiter delimiter character
     * @return prefix
     */
    public static String prefix(String value, char delimiter) {
        int pos = value.lastIndexOf(delimiter);
        return pos < 0 ? value : value.substring(0, pos);
    }

    /**
     * Returns the text after the last {@code delimiter}, or the empty string if the
     * delimiter does not occur.
     *
     * @param value input string
     * @param delimiter delimiter character
     * @return suffix
     */
    public static String suffix(String value, char delimiter) {
        int pos = value.lastIndexOf(delimiter);
        return pos < 0 ? "" : value.substring(pos + 1);
    }
}
