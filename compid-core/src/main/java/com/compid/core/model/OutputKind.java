package com.compid.core.model;

import java.util.Optional;

/**
 * Output type keywords accepted in project files.
 */
public enum OutputKind {
    /** Raw binary image */
    BIN("bin"),

    /** Executable and linkable format */
    ELF("elf"),

    /** Intel hex image */
    HEX("hex"),

    /** Static library */
    LIB("lib"),

    /** Secure-gateway import library */
    CMSE("cmse-lib");

    private final String keyword;

    OutputKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Looks up a kind by its exact keyword.
     *
     * @param keyword keyword such as {@code elf} or {@code cmse-lib}
     * @return matching kind, or empty for an unknown keyword
     */
    public static Optional<OutputKind> fromKeyword(String keyword) {
        for (OutputKind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
