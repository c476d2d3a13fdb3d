package com.toolpack.error;

/**
 * Failure of the external dependency installer (non-zero exit or launch failure).
 * Installation is best-effort: the installer logs this failure and continues.
 */
public final class DependencyInstallException extends ToolpackException {

    private final int exitCode;

    public DependencyInstallException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public DependencyInstallException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    /** Installer exit code, or -1 when the installer could not be run. */
    public int getExitCode() {
        return exitCode;
    }
}
