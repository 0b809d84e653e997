package com.compid.cli;

import com.compid.core.config.CompidConfig;
import com.compid.core.config.ConfigLoader;
import com.compid.core.model.CompilerRange;
import com.compid.core.platform.CompilerRootResolver;
import com.compid.core.platform.SystemEnvironment;
import com.compid.core.version.DottedVersionComparator;
import com.compid.core.version.IntersectionMode;
import com.compid.core.version.VersionRangeAlgebra;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Commands working on compiler specifiers {@code name[@[>=]version]}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * compid compiler expand GCC@>=10.2.0
 * compid compiler compatible GCC@6.0.0 GCC@>=10.2.0
 * compid compiler intersect GCC GCC@>=10.2.0
 * compid compiler --config build/compid.yaml intersect GCC@8.0.0..11.0.0 GCC@>=10.2.0
 * compid compiler root
 * }</pre>
 */
@Command(
    name = "compiler",
    description = "Expand, compare and intersect compiler specifiers",
    mixinStandardHelpOptions = true,
    subcommands = {
        CompilerCommand.ExpandCommand.class,
        CompilerCommand.CompatibleCommand.class,
        CompilerCommand.IntersectCommand.class,
        CompilerCommand.RootCommand.class
    }
)
public class CompilerCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompilerCommand.class);

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ${DEFAULT-VALUE})",
        defaultValue = ConfigLoader.DEFAULT_FILE_NAME)
    private Path configFile;

    @Override
    public Integer call() {
        log.error("Missing subcommand. Use: expand, compatible, intersect or root");
        return 2;
    }

    CompidConfig config() {
        return ConfigLoader.load(configFile);
    }

    VersionRangeAlgebra algebra(IntersectionMode override) {
        IntersectionMode mode = override != null ? override : config().intersectionMode();
        return new VersionRangeAlgebra(DottedVersionComparator.INSTANCE, mode);
    }

    /**
     * Prints name and bounds of a specifier.
     */
    @Command(name = "expand", description = "Print name and version bounds of a specifier",
        mixinStandardHelpOptions = true)
    public static class ExpandCommand implements Callable<Integer> {

        @ParentCommand
        private CompilerCommand parent;

        @Parameters(index = "0", description = "Compiler specifier")
        private String specifier;

        @Override
        public Integer call() {
            CompilerRange range = parent.algebra(null).expand(specifier);
            System.out.printf("name=%s%n", range.name());
            System.out.printf("min=%s%n", range.min().orElse(""));
            System.out.printf("max=%s%n", range.max().orElse(""));
            return 0;
        }
    }

    /**
     * Checks whether two specifiers can be satisfied together. Exit code 1 when not.
     */
    @Command(name = "compatible", description = "Check whether two specifiers are compatible",
        mixinStandardHelpOptions = true)
    public static class CompatibleCommand implements Callable<Integer> {

        @ParentCommand
        private CompilerCommand parent;

        @Parameters(index = "0", description = "First specifier")
        private String first;

        @Parameters(index = "1", description = "Second specifier")
        private String second;

        @Override
        public Integer call() {
            boolean compatible = parent.algebra(null).compatible(first, second);
            System.out.println(compatible);
            return compatible ? 0 : 1;
        }
    }

    /**
     * Prints the intersection of two specifiers. Exit code 1 when it is empty.
     */
    @Command(name = "intersect", description = "Print the intersection of two specifiers",
        mixinStandardHelpOptions = true)
    public static class IntersectCommand implements Callable<Integer> {

        @ParentCommand
        private CompilerCommand parent;

        @Parameters(index = "0", description = "First specifier")
        private String first;

        @Parameters(index = "1", description = "Second specifier")
        private String second;

        @Option(names = "--mode", description = "Two-sided range encoding: ${COMPLETION-CANDIDATES}")
        private IntersectionMode mode;

        @Override
        public Integer call() {
            String intersection = parent.algebra(mode).intersect(first, second);
            if (intersection.isEmpty()) {
                log.info("No usable intersection of '{}' and '{}'", first, second);
                return 1;
            }
            System.out.println(intersection);
            return 0;
        }
    }

    /**
     * Prints the compiler root directory. Exit code 1 when none is found.
     */
    @Command(name = "root", description = "Print the compiler root directory",
        mixinStandardHelpOptions = true)
    public static class RootCommand implements Callable<Integer> {

        @ParentCommand
        private CompilerCommand parent;

        @Override
        public Integer call() {
            String root = new CompilerRootResolver(new SystemEnvironment(), parent.config().rootVariable()).resolve();
            if (root.isEmpty()) {
                log.warn("Compiler root not found");
                return 1;
            }
            System.out.println(root);
            return 0;
        }
    }
}
