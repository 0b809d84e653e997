package com.compid.core.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient number parsing.
 */
public final class Numbers {

    private static final Pattern UNSIGNED_INT = Pattern.compile("^\\+?([0-9]+)$");

    private Numbers() {
        // Utility class
    }

    /**
     * Converts a string such as {@code 42} or {@code +42} to an int.
     *
     * @param value input, may be {@code null}
     * @return parsed value, or 0 for empty, malformed or out-of-range input
     */
    public static int toInt(String value) {
        if (value == null) {
            return 0;
        }
        Matcher matcher = UNSIGNED_INT.matcher(value);
        if (!matcher.matches()) {
            return 0;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
