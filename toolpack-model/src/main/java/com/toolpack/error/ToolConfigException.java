package com.toolpack.error;

/**
 * Thrown when a tool's {@code config.json} is malformed or lacks keys required for loading
 * ({@code build.entry}, {@code build.module}).
 */
public final class ToolConfigException extends ToolpackException {

    public ToolConfigException(String message) {
        super(message);
    }

    public ToolConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
