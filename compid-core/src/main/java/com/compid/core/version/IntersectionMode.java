package com.compid.core.version;

/**
 * How {@link VersionRangeAlgebra#intersect(String, String)} encodes an intersection
 * whose lower and upper bound differ.
 */
public enum IntersectionMode {
    /** Produce no output for a two-sided range (historical behaviour) */
    LEGACY,

    /** Produce {@code name@min..max}, or {@code name@min} when both bounds compare equal */
    RANGE
}
