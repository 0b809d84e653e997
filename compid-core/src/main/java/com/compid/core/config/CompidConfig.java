package com.compid.core.config;

import com.compid.core.platform.CompilerRootResolver;
import com.compid.core.version.IntersectionMode;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration, loaded from {@code compid.yaml}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * versions:
 *   intersection: RANGE
 *
 * compiler:
 *   rootVariable: CMSIS_COMPILER_ROOT
 * }</pre>
 *
 * @param versions version algebra settings
 * @param compiler compiler lookup settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompidConfig(
    @JsonProperty("versions") VersionSettings versions,
    @JsonProperty("compiler") CompilerSettings compiler
) {
    /**
     * Creates the default configuration: range intersections, standard root variable.
     *
     * @return default configuration
     */
    public static CompidConfig defaults() {
        return new CompidConfig(
            new VersionSettings(IntersectionMode.RANGE),
            new CompilerSettings(CompilerRootResolver.DEFAULT_ROOT_VARIABLE)
        );
    }

    /**
     * @return configured intersection mode, {@link IntersectionMode#RANGE} when unset
     */
    public IntersectionMode intersectionMode() {
        if (versions == null || versions.intersection() == null) {
            return IntersectionMode.RANGE;
        }
        return versions.intersection();
    }

    /**
     * @return configured compiler root variable, the default when unset
     */
    public String rootVariable() {
        if (compiler == null || compiler.rootVariable() == null || compiler.rootVariable().isBlank()) {
            return CompilerRootResolver.DEFAULT_ROOT_VARIABLE;
        }
        return compiler.rootVariable();
    }

    /**
     * Version algebra settings.
     *
     * @param intersection encoding of two-sided intersections
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VersionSettings(
        @JsonProperty("intersection") IntersectionMode intersection
    ) {}

    /**
     * Compiler lookup settings.
     *
     * @param rootVariable environment variable naming the compiler root
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CompilerSettings(
        @JsonProperty("rootVariable") String rootVariable
    ) {}
}
