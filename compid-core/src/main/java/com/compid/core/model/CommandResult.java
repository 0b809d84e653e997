package com.compid.core.model;

/**
 * Outcome of a shell command.
 *
 * @param output captured standard output
 * @param exitCode process exit code, {@link #LAUNCH_FAILED} if the process never started
 */
public record CommandResult(
    String output,
    int exitCode
) {
    public static final int LAUNCH_FAILED = -1;

    public CommandResult {
        output = output == null ? "" : output;
    }

    public static CommandResult launchFailed() {
        return new CommandResult("", LAUNCH_FAILED);
    }

    public boolean succeeded() {
        return exitCode == 0;
    }
}
