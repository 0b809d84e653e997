package com.compid.core.platform;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Process environment lookups, injected so callers can substitute them in tests.
 */
public interface Environment {

    /**
     * @param name variable name
     * @return the variable's value, or {@code null} when unset
     */
    String getenv(String name);

    /**
     * @return path of the running executable, empty when it cannot be determined
     */
    Optional<Path> executablePath();
}
