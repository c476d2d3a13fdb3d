package com.toolpack.error;

/**
 * Thrown when a version string has a non-numeric dot-separated component and therefore
 * cannot take part in numeric version ordering. Pre-release suffixes are not supported.
 */
public final class VersionFormatException extends ToolpackException {

    private final String version;

    public VersionFormatException(String version, Throwable cause) {
        super("Version is not dot-separated integers: " + version, cause);
        this.version = version;
    }

    public String getVersion() {
        return version;
    }
}
