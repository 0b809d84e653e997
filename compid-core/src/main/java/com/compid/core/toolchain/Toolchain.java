package com.compid.core.toolchain;

import com.compid.core.util.DelimiterUtils;

import java.util.Locale;

/**
 * Toolchain-specific affixes of build outputs.
 */
public enum Toolchain {
    /** Arm Compiler 6 */
    AC6(".axf", "", ".lib"),

    /** GNU Arm Embedded */
    GCC(".elf", "lib", ".a"),

    /** IAR Embedded Workbench */
    IAR(".out", "", ".a"),

    /** Any other toolchain */
    DEFAULT(".elf", "", ".a");

    private final String elfSuffix;
    private final String libPrefix;
    private final String libSuffix;

    Toolchain(String elfSuffix, String libPrefix, String libSuffix) {
        this.elfSuffix = elfSuffix;
        this.libPrefix = libPrefix;
        this.libSuffix = libSuffix;
    }

    public String elfSuffix() {
        return elfSuffix;
    }

    public String libPrefix() {
        return libPrefix;
    }

    public String libSuffix() {
        return libSuffix;
    }

    /**
     * Executable file name for a project built with this toolchain.
     *
     * @param baseName output base name
     * @return e.g. {@code blinky.axf}
     */
    public String elfName(String baseName) {
        return baseName + elfSuffix;
    }

    /**
     * Library file name for a project built with this toolchain.
     *
     * @param baseName output base name
     * @return e.g. {@code libblinky.a}
     */
    public String libName(String baseName) {
        return libPrefix + baseName + libSuffix;
    }

    /**
     * Picks the toolchain named by a compiler specifier, ignoring its version clause.
     *
     * @param compiler specifier such as {@code GCC@>=10.3.1}
     * @return matching toolchain, {@link #DEFAULT} when unknown or empty
     */
    public static Toolchain fromCompiler(String compiler) {
        if (compiler == null || compiler.isEmpty()) {
            return DEFAULT;
        }
        String name = DelimiterUtils.prefix(compiler, '@').toUpperCase(Locale.ROOT);
        for (Toolchain toolchain : values()) {
            if (toolchain != DEFAULT && toolchain.name().equals(name)) {
                return toolchain;
            }
        }
        return DEFAULT;
    }
}
