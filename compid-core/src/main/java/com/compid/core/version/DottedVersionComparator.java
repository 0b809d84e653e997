package com.compid.core.version;

import com.vdurmont.semver4j.Semver;
import com.vdurmont.semver4j.SemverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Precedence comparison of dotted versions such as {@code 6.18.0} or
 * {@code 10.3.1-rc2+build7}.
 *
 * <p>Build metadata after {@code +} is ignored and tags compare case-insensitively.
 * A missing release segment counts as {@code 0}, so {@code 1.0} equals {@code 1.0.0}
 * and the empty string equals {@code 0.0.0}. A release without pre-release tag ranks
 * above the same release with one.
 *
 * <p>Versions of up to three numeric release segments are padded to
 * {@code major.minor.patch} and compared with semver4j. Longer releases, words in the
 * release part and numbers beyond {@code int} range are compared segment by segment
 * with the same precedence rules.
 */
public final class DottedVersionComparator implements VersionComparator {

    private static final Logger log = LoggerFactory.getLogger(DottedVersionComparator.class);

    public static final DottedVersionComparator INSTANCE = new DottedVersionComparator();

    private static final int SEMVER_SEGMENTS = 3;
    private static final int MAX_INT_DIGITS = 9;

    @Override
    public int compare(String first, String second) {
        String a = normalize(first);
        String b = normalize(second);

        Semver semverA = toSemver(a);
        Semver semverB = toSemver(b);
        if (semverA != null && semverB != null) {
            if (semverA.isGreaterThan(semverB)) {
                return 1;
            }
            return semverB.isGreaterThan(semverA) ? -1 : 0;
        }
        return compareDotted(a, b);
    }

    /**
     * Pads the release to three segments and parses it strictly, or returns
     * {@code null} when the version does not fit semver's shape.
     */
    private static Semver toSemver(String version) {
        String release = release(version);
        String preRelease = preRelease(version);
        String[] segments = release.isEmpty() ? new String[0] : release.split("\\.", -1);
        if (segments.length > SEMVER_SEGMENTS) {
            return null;
        }
        for (String segment : segments) {
            if (!isNumeric(segment) || stripLeadingZeros(segment).length() > MAX_INT_DIGITS) {
                return null;
            }
        }
        if (!preRelease.isEmpty()) {
            for (String tag : preRelease.split("\\.", -1)) {
                if (tag.isEmpty() || tag.indexOf('-') >= 0
                    || (isNumeric(tag) && stripLeadingZeros(tag).length() > MAX_INT_DIGITS)) {
                    return null;
                }
            }
        } else if (version.indexOf('-') >= 0) {
            return null;
        }

        StringBuilder padded = new StringBuilder();
        for (int i = 0; i < SEMVER_SEGMENTS; i++) {
            if (i > 0) {
                padded.append('.');
            }
            padded.append(i < segments.length ? stripLeadingZeros(segments[i]) : "0");
        }
        if (!preRelease.isEmpty()) {
            padded.append('-').append(preRelease);
        }
        try {
            return new Semver(padded.toString(), Semver.SemverType.STRICT);
        } catch (SemverException e) {
            log.debug("Comparing '{}' segment by segment: {}", version, e.getMessage());
            return null;
        }
    }

    private static int compareDotted(String a, String b) {
        int result = compareSegments(release(a), release(b), "0");
        if (result != 0) {
            return result;
        }
        String preA = preRelease(a);
        String preB = preRelease(b);
        if (preA.isEmpty() || preB.isEmpty()) {
            // no tag ranks higher
            return Boolean.compare(preA.isEmpty(), preB.isEmpty());
        }
        return compareSegments(preA, preB, "");
    }

    private static int compareSegments(String first, String second, String missing) {
        String[] a = first.isEmpty() ? new String[0] : first.split("\\.", -1);
        String[] b = second.isEmpty() ? new String[0] : second.split("\\.", -1);
        int length = Math.max(a.length, b.length);
        for (int i = 0; i < length; i++) {
            String segA = i < a.length ? a[i] : missing;
            String segB = i < b.length ? b[i] : missing;
            int result = compareSegment(segA, segB);
            if (result != 0) {
                return result;
            }
        }
        return 0;
    }

    private static int compareSegment(String a, String b) {
        if (a.isEmpty() != b.isEmpty()) {
            return a.isEmpty() ? -1 : 1;
        }
        if (isNumeric(a) && isNumeric(b)) {
            String trimmedA = stripLeadingZeros(a);
            String trimmedB = stripLeadingZeros(b);
            if (trimmedA.length() != trimmedB.length()) {
                return Integer.compare(trimmedA.length(), trimmedB.length());
            }
            return Integer.signum(trimmedA.compareTo(trimmedB));
        }
        if (isNumeric(a) != isNumeric(b)) {
            // numbers sort before words
            return isNumeric(a) ? -1 : 1;
        }
        return Integer.signum(a.compareTo(b));
    }

    private static boolean isNumeric(String segment) {
        if (segment.isEmpty()) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static String stripLeadingZeros(String digits) {
        int i = 0;
        while (i < digits.length() - 1 && digits.charAt(i) == '0') {
            i++;
        }
        return digits.substring(i);
    }

    private static String normalize(String version) {
        String trimmed = version == null ? "" : version.trim();
        int plus = trimmed.indexOf('+');
        String withoutBuild = plus < 0 ? trimmed : trimmed.substring(0, plus);
        return withoutBuild.toLowerCase(Locale.ROOT);
    }

    private static String release(String version) {
        int dash = version.indexOf('-');
        return dash < 0 ? version : version.substring(0, dash);
    }

    private static String preRelease(String version) {
        int dash = version.indexOf('-');
        return dash < 0 ? "" : version.substring(dash + 1);
    }
}
