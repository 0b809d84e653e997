package com.compid.cli;

import com.compid.core.util.FileCategories;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to classify files by their extension.
 */
@Command(
    name = "category",
    description = "Print the file category of each file",
    mixinStandardHelpOptions = true
)
public class CategoryCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "File names or paths")
    private List<String> files;

    @Override
    public Integer call() {
        for (String file : files) {
            System.out.printf("%s: %s%n", file, FileCategories.categoryOf(file));
        }
        return 0;
    }
}
