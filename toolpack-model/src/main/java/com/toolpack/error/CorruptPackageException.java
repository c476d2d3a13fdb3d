package com.toolpack.error;

/**
 * Thrown when a persisted cache entry or a downloaded payload cannot be turned into
 * metadata plus files: unreadable document, bad base64, duplicate or unsafe file paths.
 */
public final class CorruptPackageException extends ToolpackException {

    public CorruptPackageException(String message) {
        super(message);
    }

    public CorruptPackageException(String message, Throwable cause) {
        super(message, cause);
    }
}
