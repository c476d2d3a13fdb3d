package com.toolpack.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * On-disk package cache. One file per cached version:
 * {@code <root>/<author>/<name>/<encoded version>.<extension>}.
 * <p>
 * Read-only lookups need no locking. Writes go through {@link PackageCodec#save} and are not
 * atomic; concurrent writers of the same key race and the last one wins.
 */
public final class CacheStore {

    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    public static final String DEFAULT_EXTENSION = "tool";

    private final Path root;
    private final String extension;

    public CacheStore(Path root) {
        this(root, DEFAULT_EXTENSION);
    }

    /**
     * @param root      cache root directory (need not exist yet)
     * @param extension cache entry extension without the dot (e.g. "tool")
     */
    public CacheStore(Path root, String extension) {
        this.root = Objects.requireNonNull(root, "root");
        if (extension == null || extension.isBlank()) {
            throw new IllegalArgumentException("extension must not be blank");
        }
        this.extension = extension;
    }

    public Path getRoot() {
        return root;
    }

    public String getExtension() {
        return extension;
    }

    /**
     * Deterministic cache path for the key. Pure: does not touch the filesystem.
     * A null version maps to {@code latest.<ext>}.
     */
    public Path cachePath(String author, String name, String version) {
        return root.resolve(author).resolve(name).resolve(VersionCodec.encode(version) + "." + extension);
    }

    /**
     * Versions cached for the tool, decoded from the entry file names, in directory order.
     * Empty when the tool has no cache directory. A {@code latest} entry carries no concrete
     * version and is skipped.
     */
    public List<String> listCachedVersions(String author, String name) {
        Path toolDir = root.resolve(author).resolve(name);
        List<String> versions = new ArrayList<>();
        if (!Files.isDirectory(toolDir)) {
            return versions;
        }
        String suffix = "." + extension;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(toolDir, "*" + suffix)) {
            for (Path entry : stream) {
                if (!Files.isRegularFile(entry)) continue;
                String fileName = entry.getFileName().toString();
                String segment = fileName.substring(0, fileName.length() - suffix.length());
                if (VersionCodec.LATEST.equals(segment)) {
                    log.warn("Ignoring version-less cache entry {}", entry);
                    continue;
                }
                versions.add(VersionCodec.decode(segment));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list cache directory " + toolDir, e);
        }
        return versions;
    }

    /**
     * Newest version by numeric component comparison, or null for an empty input.
     *
     * @throws com.toolpack.error.VersionFormatException if a version has a non-numeric component
     */
    public static String newestVersion(Collection<String> versions) {
        if (versions == null || versions.isEmpty()) {
            return null;
        }
        String newest = null;
        for (String v : versions) {
            if (newest == null) {
                VersionComparator.parse(v);
                newest = v;
            } else if (VersionComparator.INSTANCE.compare(v, newest) > 0) {
                newest = v;
            }
        }
        return newest;
    }

    /**
     * Returns {@code version} when set, otherwise the newest cached version (null if none is cached).
     */
    public String resolveVersion(String author, String name, String version) {
        if (version != null) {
            return version;
        }
        String resolved = newestVersion(listCachedVersions(author, name));
        log.debug("Resolved latest cached version of {}/{} to {}", author, name, resolved);
        return resolved;
    }

    public boolean isCached(String author, String name, String version) {
        return Files.isRegularFile(cachePath(author, name, version));
    }
}
