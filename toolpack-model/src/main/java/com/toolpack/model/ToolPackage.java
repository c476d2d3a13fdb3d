package com.toolpack.model;

import com.toolpack.error.CorruptPackageException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A tool's metadata plus the raw bytes of every file in its source tree, keyed by
 * package-root-relative path. Immutable once constructed; paths are validated with
 * {@link PackagePaths#requireSafe(String)}.
 */
public final class ToolPackage {

    public static final String CONFIG_FILE = "config.json";

    private final ToolMetadata metadata;
    private final Map<String, byte[]> files;

    /**
     * @param metadata package metadata; must not be null
     * @param files    path → content; iteration order is kept
     * @throws CorruptPackageException if any path is absolute or escapes the package root
     */
    public ToolPackage(ToolMetadata metadata, Map<String, byte[]> files) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        Map<String, byte[]> copy = new LinkedHashMap<>();
        if (files != null) {
            for (Map.Entry<String, byte[]> e : files.entrySet()) {
                String path = PackagePaths.requireSafe(e.getKey());
                if (copy.put(path, e.getValue() != null ? e.getValue().clone() : new byte[0]) != null) {
                    throw new CorruptPackageException("Duplicate file path in package: " + path);
                }
            }
        }
        this.files = Collections.unmodifiableMap(copy);
    }

    public ToolMetadata getMetadata() {
        return metadata;
    }

    /** Unmodifiable path → bytes view. Do not mutate the returned arrays. */
    public Map<String, byte[]> getFiles() {
        return files;
    }

    public Optional<byte[]> getFile(String path) {
        return Optional.ofNullable(files.get(path));
    }

    public boolean hasFile(String path) {
        return files.containsKey(path);
    }
}
