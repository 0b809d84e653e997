package com.compid.core.model;

/**
 * Identity attributes of a software pack.
 *
 * @param vendor pack vendor, may be empty
 * @param name pack name
 * @param version pack version, may be empty
 */
public record PackageAttributes(
    String vendor,
    String name,
    String version
) {
    /**
     * Compact constructor normalizing {@code null} to empty.
     */
    public PackageAttributes {
        vendor = vendor == null ? "" : vendor;
        name = name == null ? "" : name;
        version = version == null ? "" : version;
    }
}
