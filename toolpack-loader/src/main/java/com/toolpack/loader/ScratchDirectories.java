package com.toolpack.loader;

import com.toolpack.model.ToolPackage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Map;
import java.util.stream.Stream;

/** Materialization of packages into scratch directories and their removal. */
final class ScratchDirectories {

    private static final Logger log = LoggerFactory.getLogger(ScratchDirectories.class);

    private static final String PREFIX = "toolpack-";

    private ScratchDirectories() {
    }

    /**
     * Writes every package file under a new directory in {@code parent} (system temp dir when null).
     */
    static Path materialize(ToolPackage pkg, Path parent) {
        Path dir = null;
        try {
            if (parent != null) {
                Files.createDirectories(parent);
                dir = Files.createTempDirectory(parent, PREFIX);
            } else {
                dir = Files.createTempDirectory(PREFIX);
            }
            for (Map.Entry<String, byte[]> file : pkg.getFiles().entrySet()) {
                Path target = dir.resolve(file.getKey()).normalize();
                if (!target.startsWith(dir)) {
                    throw new IOException("Package file escapes scratch directory: " + file.getKey());
                }
                Files.createDirectories(target.getParent());
                Files.write(target, file.getValue());
            }
            return dir;
        } catch (IOException e) {
            if (dir != null) {
                deleteQuietly(dir);
            }
            throw new UncheckedIOException("Failed to materialize package " + pkg.getMetadata(), e);
        }
    }

    /** Deletes the directory tree; failures are logged. */
    static void deleteQuietly(Path dir) {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.warn("Failed to delete scratch file {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Failed to delete scratch directory {}: {}", dir, e.getMessage());
        }
    }
}
