package com.compid.core.model;

import java.util.Optional;

/**
 * Expanded form of a compiler specifier {@code name[@[>=]version]}.
 *
 * <p>An unconstrained bound is {@code null}. "Any version" is expressed as a
 * {@code minVersion} equal to {@link #LOWEST_VERSION} with no maximum.
 *
 * @param name compiler name, may be empty
 * @param minVersion lowest accepted version, or {@code null}
 * @param maxVersion highest accepted version, or {@code null}
 */
public record CompilerRange(
    String name,
    String minVersion,
    String maxVersion
) {
    /** Sentinel standing for "no lower bound". */
    public static final String LOWEST_VERSION = "0.0.0";

    public CompilerRange {
        name = name == null ? "" : name;
    }

    public Optional<String> min() {
        return Optional.ofNullable(minVersion);
    }

    public Optional<String> max() {
        return Optional.ofNullable(maxVersion);
    }

    public boolean isExact() {
        return maxVersion != null && maxVersion.equals(minVersion);
    }
}
