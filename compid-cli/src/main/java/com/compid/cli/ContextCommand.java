package com.compid.cli;

import com.compid.core.context.ContextNameParser;
import com.compid.core.model.ContextName;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * Command to split a context name into project, build type and target type.
 */
@Command(
    name = "context",
    description = "Split a context name <project>.<build>+<target>",
    mixinStandardHelpOptions = true
)
public class ContextCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Context name, e.g. blinky.Debug+Board")
    private String contextEntry;

    @Override
    public Integer call() {
        ContextName context = ContextNameParser.parse(contextEntry);
        System.out.printf("project=%s%n", context.project());
        System.out.printf("build=%s%n", context.build());
        System.out.printf("target=%s%n", context.target());
        return 0;
    }
}
