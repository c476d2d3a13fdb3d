package com.toolpack.error;

import java.nio.file.Path;

/**
 * Thrown when a local tool directory, its {@code config.json}, a source folder or a cache entry
 * does not exist.
 */
public final class ToolNotFoundException extends ToolpackException {

    private final Path path;

    public ToolNotFoundException(String message, Path path) {
        super(message + ": " + path);
        this.path = path;
    }

    /** Location that was expected to exist. */
    public Path getPath() {
        return path;
    }
}
