package com.compid.core.platform;

import com.compid.core.model.CommandResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Runs shell commands and captures their output.
 *
 * <p>Commands go through {@code cmd /c} on Windows and {@code sh -c} elsewhere.
 * Standard error is merged into the captured output.
 */
public final class CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    private final List<String> shell;

    public CommandRunner() {
        this(defaultShell());
    }

    /**
     * @param shell shell invocation prefix, the command string is appended as last argument
     */
    public CommandRunner(List<String> shell) {
        this.shell = List.copyOf(shell);
    }

    /**
     * Runs a command and waits for it to finish.
     *
     * @param command command line
     * @return captured output and exit code; {@link CommandResult#launchFailed()} when
     *         the process could not be started
     */
    public CommandResult run(String command) {
        ProcessBuilder builder = new ProcessBuilder(withCommand(command)).redirectErrorStream(true);
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.warn("Failed to launch '{}': {}", command, e.getMessage());
            return CommandResult.launchFailed();
        }
        try (InputStream stdout = process.getInputStream()) {
            String output = new String(stdout.readAllBytes(), StandardCharsets.UTF_8);
            int exitCode = process.waitFor();
            log.debug("'{}' exited with {}", command, exitCode);
            return new CommandResult(output, exitCode);
        } catch (IOException e) {
            log.warn("Failed to read output of '{}': {}", command, e.getMessage());
            process.destroy();
            return CommandResult.launchFailed();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            return CommandResult.launchFailed();
        }
    }

    private List<String> withCommand(String command) {
        return Stream.concat(shell.stream(), Stream.of(command)).toList();
    }

    private static List<String> defaultShell() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        return os.contains("win") ? List.of("cmd", "/c") : List.of("sh", "-c");
    }
}
