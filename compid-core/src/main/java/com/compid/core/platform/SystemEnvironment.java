package com.compid.core.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.security.CodeSource;
import java.util.Optional;

/**
 * {@link Environment} backed by the current process.
 *
 * <p>The executable path is the location of the jar (or class directory) this class
 * was loaded from.
 */
public final class SystemEnvironment implements Environment {

    private static final Logger log = LoggerFactory.getLogger(SystemEnvironment.class);

    @Override
    public String getenv(String name) {
        return System.getenv(name);
    }

    @Override
    public Optional<Path> executablePath() {
        CodeSource source = SystemEnvironment.class.getProtectionDomain().getCodeSource();
        if (source == null || source.getLocation() == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Path.of(source.getLocation().toURI()));
        } catch (URISyntaxException | IllegalArgumentException e) {
            log.debug("Cannot determine executable path from {}: {}", source.getLocation(), e.getMessage());
            return Optional.empty();
        }
    }
}
