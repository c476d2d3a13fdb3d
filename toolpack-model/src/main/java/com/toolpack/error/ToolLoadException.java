package com.toolpack.error;

/**
 * Thrown when a tool's implementation class cannot be resolved or initialized.
 * The cause carries the underlying class loading or initialization fault.
 */
public final class ToolLoadException extends ToolpackException {

    public ToolLoadException(String message) {
        super(message);
    }

    public ToolLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
