package com.compid.core.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Locates the directory holding the compiler configuration files.
 *
 * <p>Lookup order:
 * <ol>
 *   <li>the environment variable (by default {@value #DEFAULT_ROOT_VARIABLE})</li>
 *   <li>{@code <executable dir>/../etc}, if that directory exists</li>
 * </ol>
 * A found root is returned as a normalized absolute path with {@code /} separators.
 */
public final class CompilerRootResolver {

    private static final Logger log = LoggerFactory.getLogger(CompilerRootResolver.class);

    public static final String DEFAULT_ROOT_VARIABLE = "CMSIS_COMPILER_ROOT";

    private final Environment environment;
    private final String rootVariable;

    public CompilerRootResolver(Environment environment) {
        this(environment, DEFAULT_ROOT_VARIABLE);
    }

    public CompilerRootResolver(Environment environment, String rootVariable) {
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
        this.rootVariable = rootVariable == null || rootVariable.isBlank() ? DEFAULT_ROOT_VARIABLE : rootVariable;
    }

    /**
     * @return compiler root, or empty string when neither source yields one
     */
    public String resolve() {
        String root = environment.getenv(rootVariable);
        if (root != null && !root.isEmpty()) {
            log.debug("Compiler root from {}: {}", rootVariable, root);
            return normalize(Path.of(root));
        }
        Optional<Path> fallback = environment.executablePath()
            .map(Path::toAbsolutePath)
            .map(Path::getParent)
            .map(Path::getParent)
            .map(dir -> dir.resolve("etc"))
            .filter(Files::isDirectory);
        if (fallback.isEmpty()) {
            log.debug("No compiler root: {} unset and no etc directory next to the executable", rootVariable);
            return "";
        }
        log.debug("Compiler root next to executable: {}", fallback.get());
        return normalize(fallback.get());
    }

    private static String normalize(Path path) {
        return path.toAbsolutePath().normalize().toString().replace('\\', '/');
    }
}
