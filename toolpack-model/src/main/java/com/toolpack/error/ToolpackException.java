package com.toolpack.error;

/**
 * Base type for structural failures raised while packaging, caching or loading tools.
 * Callers that only care about "the tool is unusable" can catch this single type.
 */
public class ToolpackException extends RuntimeException {

    public ToolpackException(String message) {
        super(message);
    }

    public ToolpackException(String message, Throwable cause) {
        super(message, cause);
    }
}
