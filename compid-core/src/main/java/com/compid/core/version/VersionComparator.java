package com.compid.core.version;

/**
 * Total order over version strings.
 */
@FunctionalInterface
public interface VersionComparator {

    /**
     * Compares two version strings.
     *
     * @param first first version
     * @param second second version
     * @return negative, zero or positive when {@code first} is lower than, equal to or
     *         greater than {@code second}
     */
    int compare(String first, String second);
}
