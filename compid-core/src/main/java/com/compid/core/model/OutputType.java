package com.compid.core.model;

/**
 * A single output toggle.
 *
 * @param on whether this output is produced
 * @param filename target filename, empty when not set
 */
public record OutputType(
    boolean on,
    String filename
) {
    public static final OutputType OFF = new OutputType(false, "");

    public OutputType {
        filename = filename == null ? "" : filename;
    }

    public OutputType enabled() {
        return new OutputType(true, filename);
    }

    public OutputType withFilename(String filename) {
        return new OutputType(on, filename);
    }
}
