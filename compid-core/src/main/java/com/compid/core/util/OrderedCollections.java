package com.compid.core.util;

import java.util.List;

/**
 * Helpers for insertion-ordered collections used as sets.
 */
public final class OrderedCollections {

    private OrderedCollections() {
        // Utility class
    }

    /**
     * Appends {@code value} unless an equal element is already present.
     *
     * <p>Works for any element type with value equality, e.g. strings or
     * {@code Map.entry(first, second)} pairs.
     *
     * @param list target list, must be mutable
     * @param value value to append
     * @param <T> element type
     * @return {@code true} if the value was appended
     */
    public static <T> boolean addUniquely(List<T> list, T value) {
        if (list.contains(value)) {
            return false;
        }
        return list.add(value);
    }
}
