package com.toolpack.registry;

import com.toolpack.error.ToolpackException;

/**
 * Registry call failure: connection error, timeout, non-2xx status or unreadable response body.
 */
public final class RegistryException extends ToolpackException {

    private final int statusCode;

    public RegistryException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public RegistryException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status, or -1 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
