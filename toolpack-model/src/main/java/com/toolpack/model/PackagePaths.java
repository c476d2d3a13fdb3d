package com.toolpack.model;

import com.toolpack.error.CorruptPackageException;

/**
 * Validation of package-relative file paths. Paths use {@code /} separators, are relative,
 * and never contain {@code ..} or empty segments, so materializing a package cannot write
 * outside its root.
 */
public final class PackagePaths {

    private PackagePaths() {
    }

    /**
     * Returns the path unchanged if it is safe.
     *
     * @throws CorruptPackageException if the path is blank, absolute, contains a backslash,
     *                                 or has an empty, {@code .} or {@code ..} segment
     */
    public static String requireSafe(String path) {
        if (path == null || path.isBlank()) {
            throw new CorruptPackageException("Package file path is blank");
        }
        if (path.startsWith("/") || path.contains("\\")) {
            throw new CorruptPackageException("Package file path is not relative: " + path);
        }
        for (String segment : path.split("/", -1)) {
            if (segment.isEmpty() || ".".equals(segment) || "..".equals(segment)) {
                throw new CorruptPackageException("Package file path escapes the package root: " + path);
            }
        }
        return path;
    }
}
