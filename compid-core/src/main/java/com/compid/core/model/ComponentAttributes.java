package com.compid.core.model;

import java.util.Map;

/**
 * Attribute set of a software component as supplied by pack metadata.
 *
 * <p>Every field except {@code cclass} is optional; an absent field is held as the
 * empty string, never as {@code null}.
 *
 * @param vendor component vendor ({@code Cvendor})
 * @param cclass component class ({@code Cclass}), required for identifiers
 * @param bundle bundle name ({@code Cbundle})
 * @param group group name ({@code Cgroup})
 * @param sub sub-group name ({@code Csub})
 * @param variant variant name ({@code Cvariant})
 * @param version component version ({@code Cversion})
 */
public record ComponentAttributes(
    String vendor,
    String cclass,
    String bundle,
    String group,
    String sub,
    String variant,
    String version
) {
    public static final String CVENDOR = "Cvendor";
    public static final String CCLASS = "Cclass";
    public static final String CBUNDLE = "Cbundle";
    public static final String CGROUP = "Cgroup";
    public static final String CSUB = "Csub";
    public static final String CVARIANT = "Cvariant";
    public static final String CVERSION = "Cversion";

    /**
     * Compact constructor normalizing {@code null} to empty.
     */
    public ComponentAttributes {
        vendor = orEmpty(vendor);
        cclass = orEmpty(cclass);
        bundle = orEmpty(bundle);
        group = orEmpty(group);
        sub = orEmpty(sub);
        variant = orEmpty(variant);
        version = orEmpty(version);
    }

    /**
     * Starts a builder for the given component class.
     *
     * @param cclass component class
     * @return new builder
     */
    public static Builder of(String cclass) {
        return new Builder().cclass(cclass);
    }

    /**
     * Reads the attributes from a metadata attribute map keyed by {@code Cvendor},
     * {@code Cclass} and so on. Missing keys become empty fields.
     *
     * @param attributes attribute map
     * @return component attributes
     */
    public static ComponentAttributes fromMap(Map<String, String> attributes) {
        return new ComponentAttributes(
            attributes.get(CVENDOR),
            attributes.get(CCLASS),
            attributes.get(CBUNDLE),
            attributes.get(CGROUP),
            attributes.get(CSUB),
            attributes.get(CVARIANT),
            attributes.get(CVERSION)
        );
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }

    /**
     * Fluent builder, mostly for callers that only know a few fields.
     */
    public static final class Builder {
        private String vendor;
        private String cclass;
        private String bundle;
        private String group;
        private String sub;
        private String variant;
        private String version;

        public Builder vendor(String vendor) {
            this.vendor = vendor;
            return this;
        }

        public Builder cclass(String cclass) {
            this.cclass = cclass;
            return this;
        }

        public Builder bundle(String bundle) {
            this.bundle = bundle;
            return this;
        }

        public Builder group(String group) {
            this.group = group;
            return this;
        }

        public Builder sub(String sub) {
            this.sub = sub;
            return this;
        }

        public Builder variant(String variant) {
            this.variant = variant;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public ComponentAttributes build() {
            return new ComponentAttributes(vendor, cclass, bundle, group, sub, variant, version);
        }
    }
}
