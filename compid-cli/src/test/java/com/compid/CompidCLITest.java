package com.compid;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CompidCLI} option handling.
 */
@DisplayName("compid CLI")
class CompidCLITest {

    @Test
    @DisplayName("Should register every subcommand")
    void shouldRegisterSubcommands() {
        CommandLine commandLine = CompidCLI.commandLine();

        assertThat(commandLine.getSubcommands())
            .containsOnlyKeys("id", "decompose", "compiler", "context", "category");
        assertThat(commandLine.getSubcommands().get("compiler").getSubcommands())
            .containsOnlyKeys("expand", "compatible", "intersect", "root");
    }

    @Test
    @DisplayName("Should parse global verbosity flags")
    void shouldParseVerbosityFlags() {
        CompidCLI cli = new CompidCLI();
        new CommandLine(cli).parseArgs("-v");

        assertThat(cli.isVerbose()).isTrue();
        assertThat(cli.isQuiet()).isFalse();
    }

    @Test
    @DisplayName("Should exit with zero without a command")
    void shouldExitZeroWithoutCommand() {
        int exitCode = CompidCLI.commandLine().execute("-q");

        assertThat(exitCode).isZero();
    }
}
