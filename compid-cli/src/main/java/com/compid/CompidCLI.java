package com.compid;

import com.compid.cli.CategoryCommand;
import com.compid.cli.CompilerCommand;
import com.compid.cli.ContextCommand;
import com.compid.cli.DecomposeCommand;
import com.compid.cli.IdCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for compid.
 *
 * <p>compid builds and parses component identifiers, reasons about compiler version
 * constraints and splits context names.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code id} - Build a component identifier from attributes</li>
 *   <li>{@code decompose} - Parse a component identifier into attributes</li>
 *   <li>{@code compiler} - Expand, compare and intersect compiler specifiers</li>
 *   <li>{@code context} - Split a context name into project, build and target</li>
 *   <li>{@code category} - Classify files by extension</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * compid id --class Driver --group USART --version 1.0.0
 * compid decompose "ARM::CMSIS:CORE@5.6.0" --json
 * compid compiler intersect GCC GCC@>=10.2.0
 * compid context blinky.Debug+Board
 * }</pre>
 */
@Command(
    name = "compid",
    mixinStandardHelpOptions = true,
    version = "compid 1.0.0-SNAPSHOT",
    description = "Component identifiers and compiler version constraints",
    subcommands = {
        IdCommand.class,
        DecomposeCommand.class,
        CompilerCommand.class,
        ContextCommand.class,
        CategoryCommand.class
    }
)
public class CompidCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CompidCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("compid - Component identifiers and compiler version constraints");
        System.out.println();
        System.out.println("Use 'compid --help' to see available commands");
        System.out.println("Use 'compid <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        CompidCLI cli = new CompidCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
