package com.compid.core.model;

/**
 * Parsed form of a context string {@code project[.build][+target]}.
 *
 * @param project project name
 * @param build build type, empty when absent
 * @param target target type, empty when absent
 */
public record ContextName(
    String project,
    String build,
    String target
) {
    public ContextName {
        project = project == null ? "" : project;
        build = build == null ? "" : build;
        target = target == null ? "" : target;
    }

    /**
     * Reassembles the context string, omitting absent parts with their separator.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(project);
        if (!build.isEmpty()) {
            sb.append('.').append(build);
        }
        if (!target.isEmpty()) {
            sb.append('+').append(target);
        }
        return sb.toString();
    }
}
