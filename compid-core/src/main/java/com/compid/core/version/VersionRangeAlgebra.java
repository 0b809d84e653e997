package com.compid.core.version;

import com.compid.core.model.CompilerRange;
import com.compid.core.util.DelimiterUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Compatibility checks and intersections of compiler specifiers.
 *
 * <p>A specifier has one of the forms
 * <ul>
 *   <li>{@code GCC} - any version</li>
 *   <li>{@code GCC@10.3.1} - exactly this version</li>
 *   <li>{@code GCC@>=10.3.1} - this version or later</li>
 *   <li>{@code GCC@10.3.1..12.2.0} - a closed range</li>
 * </ul>
 *
 * <p>Instances are immutable and can be shared between threads. An empty specifier
 * places no constraint and is compatible with everything. A closed range whose lower
 * bound lies above its upper bound is satisfied by no compiler.
 */
public final class VersionRangeAlgebra {

    private static final Logger log = LoggerFactory.getLogger(VersionRangeAlgebra.class);

    private static final char VERSION_CHAR = '@';
    private static final String MIN_PREFIX = ">=";
    private static final String RANGE_SEPARATOR = "..";

    private final VersionComparator comparator;
    private final IntersectionMode mode;

    /**
     * Creates an algebra with the dotted comparator and {@link IntersectionMode#RANGE}.
     */
    public VersionRangeAlgebra() {
        this(DottedVersionComparator.INSTANCE, IntersectionMode.RANGE);
    }

    public VersionRangeAlgebra(VersionComparator comparator, IntersectionMode mode) {
        this.comparator = Objects.requireNonNull(comparator, "comparator must not be null");
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
    }

    public IntersectionMode mode() {
        return mode;
    }

    /**
     * Expands a specifier into name and bounds.
     *
     * @param specifier compiler specifier, {@code null} treated as empty
     * @return expanded range
     */
    public CompilerRange expand(String specifier) {
        String compiler = specifier == null ? "" : specifier;
        String name = DelimiterUtils.prefix(compiler, VERSION_CHAR);
        String version = DelimiterUtils.suffix(compiler, VERSION_CHAR);
        if (version.isEmpty()) {
            return new CompilerRange(name, CompilerRange.LOWEST_VERSION, null);
        }
        if (version.startsWith(MIN_PREFIX)) {
            return new CompilerRange(name, version.substring(MIN_PREFIX.length()), null);
        }
        int separator = version.indexOf(RANGE_SEPARATOR);
        if (separator >= 0) {
            return new CompilerRange(name,
                version.substring(0, separator),
                version.substring(separator + RANGE_SEPARATOR.length()));
        }
        return new CompilerRange(name, version, version);
    }

    /**
     * Checks whether both specifiers can be satisfied by the same compiler.
     *
     * @param first first specifier
     * @param second second specifier
     * @return {@code true} if either is empty, or names match and the ranges overlap
     */
    public boolean compatible(String first, String second) {
        if (isEmpty(first) || isEmpty(second)) {
            return true;
        }
        return compatible(expand(first), expand(second));
    }

    private boolean compatible(CompilerRange first, CompilerRange second) {
        if (!first.name().equals(second.name()) || isInverted(first) || isInverted(second)) {
            return false;
        }
        if (first.maxVersion() != null && second.minVersion() != null
            && comparator.compare(first.maxVersion(), second.minVersion()) < 0) {
            return false;
        }
        return second.maxVersion() == null || first.minVersion() == null
            || comparator.compare(second.maxVersion(), first.minVersion()) >= 0;
    }

    /**
     * Computes the specifier accepted by both inputs.
     *
     * @param first first specifier
     * @param second second specifier
     * @return intersection, or the empty string when both inputs are empty, when they
     *         are incompatible, when the merged bounds are inverted, or when the
     *         result cannot be expressed in the current
     *         {@link IntersectionMode}
     */
    public String intersect(String first, String second) {
        if ((isEmpty(first) && isEmpty(second)) || !compatible(first, second)) {
            return "";
        }
        CompilerRange a = expand(first);
        CompilerRange b = expand(second);

        String firstMax = a.maxVersion() == null ? b.maxVersion() : a.maxVersion();
        String secondMax = b.maxVersion() == null ? firstMax : b.maxVersion();

        String name = a.name().isEmpty() ? b.name() : a.name();
        String min = comparator.compare(a.minVersion(), b.minVersion()) < 0 ? b.minVersion() : a.minVersion();
        String max = firstMax == null ? null
            : comparator.compare(firstMax, secondMax) > 0 ? secondMax : firstMax;

        return encode(name, min, max);
    }

    private String encode(String name, String min, String max) {
        if (max == null) {
            if (comparator.compare(min, CompilerRange.LOWEST_VERSION) == 0) {
                return name;
            }
            return name + VERSION_CHAR + MIN_PREFIX + min;
        }
        if (min.equals(max)) {
            return name + VERSION_CHAR + min;
        }
        int order = comparator.compare(min, max);
        if (order > 0) {
            log.debug("Empty intersection for {}: {} is above {}", name, min, max);
            return "";
        }
        if (mode == IntersectionMode.LEGACY) {
            log.debug("No encoding for range {}..{} of {} in legacy mode", min, max, name);
            return "";
        }
        if (order == 0) {
            return name + VERSION_CHAR + min;
        }
        return name + VERSION_CHAR + min + RANGE_SEPARATOR + max;
    }

    private boolean isInverted(CompilerRange range) {
        return range.maxVersion() != null && comparator.compare(range.minVersion(), range.maxVersion()) > 0;
    }

    private static boolean isEmpty(String specifier) {
        return specifier == null || specifier.isEmpty();
    }
}
