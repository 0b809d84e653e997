package com.compid.core.context;

import com.compid.core.model.ContextName;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a context string {@code project[.build][+target]} into its parts.
 *
 * <p>Each part is extracted by its own pattern against the whole input, so the
 * {@code .build} and {@code +target} suffixes may appear in either order. Every
 * pattern has two alternatives of which at most one can match; the part takes the
 * group of the matching alternative and is empty when neither matches.
 *
 * <pre>{@code
 * ContextNameParser.parse("blinky.Debug+Board");  // (blinky, Debug, Board)
 * ContextNameParser.parse("blinky+Board.Debug");  // (blinky, Debug, Board)
 * ContextNameParser.parse("blinky+Board");        // (blinky, "", Board)
 * }</pre>
 */
public final class ContextNameParser {

    // project: before the first '.' or '+', or the whole string
    public static final Pattern PROJECT_PATTERN =
        Pattern.compile("^(.*?)[.+].*$|^(.*)$");

    // build: after '.', optionally followed by '+'
    public static final Pattern BUILD_PATTERN =
        Pattern.compile("^.*\\.(.*)\\+.*$|^.*\\.(.*).*$");

    // target: after '+', optionally followed by '.'
    public static final Pattern TARGET_PATTERN =
        Pattern.compile("^.*\\+(.*)\\..*$|^.*\\+(.*).*$");

    private ContextNameParser() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Parses a context string.
     *
     * @param contextEntry context string, {@code null} treated as empty
     * @return parsed context name
     */
    public static ContextName parse(String contextEntry) {
        String entry = contextEntry == null ? "" : contextEntry;
        return new ContextName(
            extract(PROJECT_PATTERN, entry),
            extract(BUILD_PATTERN, entry),
            extract(TARGET_PATTERN, entry)
        );
    }

    private static String extract(Pattern pattern, String entry) {
        Matcher matcher = pattern.matcher(entry);
        if (!matcher.matches()) {
            return "";
        }
        if (matcher.group(1) != null) {
            return matcher.group(1);
        }
        return matcher.group(2) != null ? matcher.group(2) : "";
    }
}
