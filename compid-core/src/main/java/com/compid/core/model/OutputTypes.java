package com.compid.core.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Selection of the outputs a build produces. The five toggles are independent.
 *
 * @param bin binary image
 * @param elf executable
 * @param hex hex image
 * @param lib static library
 * @param cmse secure-gateway library
 */
public record OutputTypes(
    OutputType bin,
    OutputType elf,
    OutputType hex,
    OutputType lib,
    OutputType cmse
) {
    public OutputTypes {
        bin = bin == null ? OutputType.OFF : bin;
        elf = elf == null ? OutputType.OFF : elf;
        hex = hex == null ? OutputType.OFF : hex;
        lib = lib == null ? OutputType.OFF : lib;
        cmse = cmse == null ? OutputType.OFF : cmse;
    }

    /**
     * @return a selection with every output switched off
     */
    public static OutputTypes none() {
        return new OutputTypes(OutputType.OFF, OutputType.OFF, OutputType.OFF, OutputType.OFF, OutputType.OFF);
    }

    /**
     * Switches on the output named by {@code keyword}. Unknown keywords leave the
     * selection unchanged.
     *
     * @param keyword one of {@code bin}, {@code elf}, {@code hex}, {@code lib}, {@code cmse-lib}
     * @return updated selection
     */
    public OutputTypes withType(String keyword) {
        return OutputKind.fromKeyword(keyword)
            .map(kind -> with(kind, get(kind).enabled()))
            .orElse(this);
    }

    /**
     * Sets the filename of the output named by {@code keyword}.
     *
     * @param keyword output keyword
     * @param filename target filename
     * @return updated selection, unchanged for an unknown keyword
     */
    public OutputTypes withFilename(String keyword, String filename) {
        return OutputKind.fromKeyword(keyword)
            .map(kind -> with(kind, get(kind).withFilename(filename)))
            .orElse(this);
    }

    public OutputType get(OutputKind kind) {
        return switch (kind) {
            case BIN -> bin;
            case ELF -> elf;
            case HEX -> hex;
            case LIB -> lib;
            case CMSE -> cmse;
        };
    }

    /**
     * @return the toggles that are switched on, in declaration order
     */
    public Map<OutputKind, OutputType> enabled() {
        Map<OutputKind, OutputType> result = new EnumMap<>(OutputKind.class);
        for (OutputKind kind : OutputKind.values()) {
            if (get(kind).on()) {
                result.put(kind, get(kind));
            }
        }
        return result;
    }

    private OutputTypes with(OutputKind kind, OutputType type) {
        return switch (kind) {
            case BIN -> new OutputTypes(type, elf, hex, lib, cmse);
            case ELF -> new OutputTypes(bin, type, hex, lib, cmse);
            case HEX -> new OutputTypes(bin, elf, type, lib, cmse);
            case LIB -> new OutputTypes(bin, elf, hex, type, cmse);
            case CMSE -> new OutputTypes(bin, elf, hex, lib, type);
        };
    }
}
