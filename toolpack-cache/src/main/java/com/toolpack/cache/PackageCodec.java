package com.toolpack.cache;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.toolpack.error.CorruptPackageException;
import com.toolpack.error.ToolNotFoundException;
import com.toolpack.model.PackageFile;
import com.toolpack.model.ToolJson;
import com.toolpack.model.ToolMetadata;
import com.toolpack.model.ToolPackage;
import com.toolpack.model.ToolPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persists a {@link ToolPackage} as a single JSON cache entry and converts between packages and
 * transport payloads. Entry layout:
 * <pre>
 * { "formatVersion": 1, "metadata": {...}, "files": [ { "path": "...", "content": "&lt;base64&gt;" } ] }
 * </pre>
 */
public final class PackageCodec {

    private static final Logger log = LoggerFactory.getLogger(PackageCodec.class);

    static final int FORMAT_VERSION = 1;

    private PackageCodec() {
    }

    /**
     * Writes the package to {@code path}, creating parent directories and replacing any existing entry.
     * Not atomic: a failure mid-write can leave a truncated entry that later loads as corrupt.
     */
    public static void save(ToolPackage pkg, Path path) {
        CacheDocument doc = new CacheDocument(FORMAT_VERSION, pkg.getMetadata(), encodeFiles(pkg.getFiles()));
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(path, ToolJson.toJsonBytes(doc));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write cache entry " + path, e);
        }
        log.debug("Saved {} ({} file(s)) to {}", pkg.getMetadata(), pkg.getFiles().size(), path);
    }

    /**
     * Reads a cache entry.
     *
     * @throws ToolNotFoundException   if {@code path} does not exist
     * @throws CorruptPackageException if the entry is not a readable package document
     */
    public static ToolPackage load(Path path) {
        if (!Files.exists(path)) {
            throw new ToolNotFoundException("Cache entry not found", path);
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read cache entry " + path, e);
        }
        CacheDocument doc;
        try {
            doc = ToolJson.mapper().readValue(bytes, CacheDocument.class);
        } catch (IOException e) {
            throw new CorruptPackageException("Cache entry is not a package document: " + path, e);
        }
        if (doc == null || doc.metadata == null || doc.files == null) {
            throw new CorruptPackageException("Cache entry lacks metadata or files: " + path);
        }
        return new ToolPackage(doc.metadata, decodeFiles(doc.files));
    }

    /**
     * Builds a package from a downloaded or freshly built payload, decoding base64 contents.
     *
     * @throws CorruptPackageException on invalid base64, duplicate or unsafe paths
     */
    public static ToolPackage fromPayload(ToolPayload payload) {
        return new ToolPackage(payload.toMetadata(), decodeFiles(payload.getFiles()));
    }

    /** Transport form of the package with base64 contents. */
    public static ToolPayload toPayload(ToolPackage pkg) {
        ToolMetadata m = pkg.getMetadata();
        return new ToolPayload(m.getAuthor(), m.getName(), m.getVersion(), m.getLicense(),
                encodeFiles(pkg.getFiles()), m.getEntry(), m.getModule());
    }

    private static List<PackageFile> encodeFiles(Map<String, byte[]> files) {
        Base64.Encoder encoder = Base64.getEncoder();
        List<PackageFile> out = new ArrayList<>(files.size());
        for (Map.Entry<String, byte[]> e : files.entrySet()) {
            out.add(new PackageFile(e.getKey(), encoder.encodeToString(e.getValue())));
        }
        return out;
    }

    private static Map<String, byte[]> decodeFiles(List<PackageFile> files) {
        Base64.Decoder decoder = Base64.getDecoder();
        Map<String, byte[]> out = new LinkedHashMap<>();
        for (PackageFile file : files) {
            if (file == null || file.getPath() == null) {
                throw new CorruptPackageException("Package file without a path");
            }
            byte[] content;
            try {
                content = file.getContent() != null ? decoder.decode(file.getContent()) : new byte[0];
            } catch (IllegalArgumentException e) {
                throw new CorruptPackageException("Invalid base64 content for " + file.getPath(), e);
            }
            if (out.put(file.getPath(), content) != null) {
                throw new CorruptPackageException("Duplicate file path in package: " + file.getPath());
            }
        }
        return out;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class CacheDocument {
        @JsonProperty("formatVersion")
        final int formatVersion;
        @JsonProperty("metadata")
        final ToolMetadata metadata;
        @JsonProperty("files")
        final List<PackageFile> files;

        @JsonCreator
        CacheDocument(
                @JsonProperty("formatVersion") int formatVersion,
                @JsonProperty("metadata") ToolMetadata metadata,
                @JsonProperty("files") List<PackageFile> files) {
            this.formatVersion = formatVersion;
            this.metadata = metadata;
            this.files = files;
        }
    }
}
